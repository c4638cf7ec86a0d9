package com.example.docxdiff;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

/**
 * 按下标对齐两份文档的段落：两边都有 → 逐 token 比对；只有原稿 → 整段删除；只有修订稿 → 整段插入；
 * 文本相同（或开启空白抑制时只差空白）→ 修订稿段落原样保留。
 * 这里只算出每个下标的类别和编辑脚本；LCS 在线程池里并发算、按下标写回。run 合成与 w:id 分配由 {@link BodyRebuilder} 按文档顺序串行完成。
 */
@Slf4j
public final class ParagraphAligner {
    private ParagraphAligner() {}

    private static final int PARALLELISM =
            ResourceLimits.getEnvInt("DOCXDIFF_CONCURRENCY", Runtime.getRuntime().availableProcessors());

    enum Kind { BOTH, BASE_ONLY, REVISED_ONLY, UNCHANGED }

    /** 对齐结果。修订稿段落按对象身份索引（结构相同的两个段落也要区分开） */
    public static final class Alignment {
        final List<XmlElement> base;
        final List<XmlElement> revised;
        final Kind[] kinds;
        final List<EditOperation>[] scripts;
        final Map<XmlElement, Integer> revisedIndex = new IdentityHashMap<>();

        @SuppressWarnings("unchecked")
        private Alignment(List<XmlElement> base, List<XmlElement> revised) {
            this.base = base;
            this.revised = revised;
            int n = Math.max(base.size(), revised.size());
            this.kinds = new Kind[n];
            this.scripts = new List[n];
            for (int i = 0; i < revised.size(); i++) revisedIndex.put(revised.get(i), i);
        }

        public int size() { return kinds.length; }

        Kind kind(int i) { return kinds[i]; }

        /** 没有任何修订标记的下标个数 */
        public int unchangedCount() {
            int c = 0;
            for (Kind k : kinds) if (k == Kind.UNCHANGED) c++;
            return c;
        }
    }

    public static Alignment align(List<XmlElement> base, List<XmlElement> revised, DiffOptions options, List<String> warnings) {
        final Alignment al = new Alignment(base, revised);
        final int n = al.size();
        final int cap = options.limits.maxTokensPerParagraph;
        String[] baseText = new String[n];
        String[] revText = new String[n];
        List<Integer> lcsJobs = new ArrayList<>();

        for (int i = 0; i < n; i++) {
            XmlElement bp = i < base.size() ? base.get(i) : null;
            XmlElement rp = i < revised.size() ? revised.get(i) : null;
            baseText[i] = ParagraphModel.textOf(bp);
            revText[i] = ParagraphModel.textOf(rp);

            if (rp == null) { al.kinds[i] = Kind.BASE_ONLY; continue; }
            if (bp == null) {
                al.kinds[i] = Kind.REVISED_ONLY;
                al.scripts[i] = opaqueScript("", revText[i]);
                continue;
            }

            String a = baseText[i], b = revText[i];
            if (a.equals(b) || (options.suppressWhitespaceOnly && collapseWhitespace(a).equals(collapseWhitespace(b)))) {
                al.kinds[i] = Kind.UNCHANGED;
                continue;
            }
            al.kinds[i] = Kind.BOTH;
            if (Tokenizer.countUpTo(a, options.granularity, cap) > cap
                    || Tokenizer.countUpTo(b, options.granularity, cap) > cap) {
                al.scripts[i] = opaqueScript(a, b);
                warnings.add("Paragraph " + (i + 1) + " exceeds " + cap + " tokens; diffed as a whole");
            } else {
                lcsJobs.add(i);
            }
        }

        computeScripts(lcsJobs, baseText, revText, options.granularity, al.scripts);
        log.debug("aligned paragraphs: base={}, revised={}, lcs={}", base.size(), revised.size(), lcsJobs.size());
        return al;
    }

    /** 去掉首尾空白并把内部连续空白折叠成一个空格 */
    static String collapseWhitespace(String s) {
        return s == null ? "" : s.trim().replaceAll("\\s+", " ");
    }

    static List<EditOperation> opaqueScript(String a, String b) {
        List<EditOperation> ops = new ArrayList<>(2);
        if (a.equals(b)) {
            if (!a.isEmpty()) ops.add(EditOperation.equal(a));
            return ops;
        }
        if (!a.isEmpty()) ops.add(EditOperation.delete(a));
        if (!b.isEmpty()) ops.add(EditOperation.insert(b));
        return ops;
    }

    // 并发跑 LCS，按下标保序（只有一段时直接串行）
    private static void computeScripts(List<Integer> jobs, String[] a, String[] b, Granularity g, List<EditOperation>[] scripts) {
        if (jobs.isEmpty()) return;
        if (jobs.size() == 1 || PARALLELISM <= 1) {
            for (int i : jobs) scripts[i] = diffTexts(a[i], b[i], g);
            return;
        }

        int poolSize = Math.min(PARALLELISM, jobs.size());
        ExecutorService exec = Executors.newFixedThreadPool(poolSize);
        List<Callable<Void>> tasks = new ArrayList<>(jobs.size());
        for (int i : jobs) {
            tasks.add(() -> {
                scripts[i] = diffTexts(a[i], b[i], g);
                return null;
            });
        }
        try {
            List<Future<Void>> fs = exec.invokeAll(tasks);
            for (Future<Void> f : fs) f.get(); // 触发异常传播
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("parallel diff interrupted, falling back to sequential...");
            for (int i : jobs) if (scripts[i] == null) scripts[i] = diffTexts(a[i], b[i], g);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("paragraph diff failed: " + cause, cause);
        } finally {
            exec.shutdownNow();
        }
    }

    static List<EditOperation> diffTexts(String a, String b, Granularity g) {
        return SequenceDiffer.diff(Tokenizer.tokenize(a, g), Tokenizer.tokenize(b, g));
    }
}
