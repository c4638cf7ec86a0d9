package com.example.docxdiff;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 精确 LCS 对齐。dp[i][j] 为 a[i:] 与 b[j:] 的最长公共子序列长度，自底向上填表，O(|a|·|b|) 时间与空间，
 * 只按段落调用。回溯时平局优先删除，保证替换处总是“先删后插”。
 */
public final class SequenceDiffer {
    private SequenceDiffer() {}

    public static List<EditOperation> diff(List<String> a, List<String> b) {
        final int m = a.size(), n = b.size();
        int[][] dp = new int[m + 1][n + 1];
        for (int i = m - 1; i >= 0; i--) {
            for (int j = n - 1; j >= 0; j--) {
                dp[i][j] = Objects.equals(a.get(i), b.get(j))
                    ? dp[i + 1][j + 1] + 1
                    : Math.max(dp[i + 1][j], dp[i][j + 1]);
            }
        }

        List<EditOperation> ops = new ArrayList<>(Math.max(m, n));
        int i = 0, j = 0;
        while (i < m && j < n) {
            if (Objects.equals(a.get(i), b.get(j))) {
                ops.add(EditOperation.equal(a.get(i)));
                i++; j++;
            } else if (dp[i + 1][j] >= dp[i][j + 1]) {
                ops.add(EditOperation.delete(a.get(i++)));
            } else {
                ops.add(EditOperation.insert(b.get(j++)));
            }
        }
        while (i < m) ops.add(EditOperation.delete(a.get(i++)));
        while (j < n) ops.add(EditOperation.insert(b.get(j++)));
        return ops;
    }

    /** 脚本中 EQUAL 的个数，即 LCS 长度 */
    public static int commonLength(List<EditOperation> script) {
        int n = 0;
        for (EditOperation op : script) if (op.getType() == EditOperation.Type.EQUAL) n++;
        return n;
    }
}
