package com.example.docxdiff;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * 只读的 DOCX 包。打开时只看中央目录：条目数、压缩大小累加（按解压上限的 2 倍粗估）、
 * 声明的单条目大小、重名条目；真正解压在 {@link #readPart(String)} 时按上限边读边计数。
 */
@Slf4j
public final class DocxArchive implements Closeable {

    private final ZipFile zip;
    private final ResourceLimits limits;
    private final Map<String, ZipArchiveEntry> entries;
    private final long compressedTotal;
    private final Map<String, byte[]> inflated = new HashMap<>();
    private long inflatedTotal;

    private DocxArchive(ZipFile zip, ResourceLimits limits, Map<String, ZipArchiveEntry> entries, long compressedTotal) {
        this.zip = zip;
        this.limits = limits;
        this.entries = entries;
        this.compressedTotal = compressedTotal;
    }

    public static DocxArchive open(byte[] bytes, ResourceLimits limits) throws ArchiveException {
        if (bytes == null || bytes.length == 0) throw new ArchiveException("Not a valid DOCX package: empty input");
        ResourceLimits lim = limits == null ? ResourceLimits.defaults() : limits;

        ZipFile zip;
        try {
            zip = ZipFile.builder().setSeekableByteChannel(new SeekableInMemoryByteChannel(bytes)).get();
        } catch (IOException e) {
            throw new ArchiveException("Not a valid DOCX package: " + e.getMessage(), e);
        }

        try {
            Map<String, ZipArchiveEntry> byName = new LinkedHashMap<>();
            long approxTotal = 0;
            Enumeration<ZipArchiveEntry> en = zip.getEntries();
            while (en.hasMoreElements()) {
                ZipArchiveEntry e = en.nextElement();
                if (byName.size() + 1 > lim.maxEntries) {
                    throw new ArchiveException("DOCX has too many entries (limit " + lim.maxEntries + ")");
                }
                approxTotal += Math.max(0, e.getCompressedSize());
                if (approxTotal / 2 > lim.maxTotalUnzippedBytes) {
                    throw new ArchiveException("DOCX likely exceeds unzip cap (" + lim.maxTotalUnzippedBytes + " bytes)");
                }
                if (e.getSize() > lim.maxEntrySize) {
                    throw new ArchiveException("DOCX entry " + e.getName() + " exceeds per-entry cap (" + lim.maxEntrySize + " bytes)");
                }
                String name = normalize(e.getName());
                if (byName.putIfAbsent(name, e) != null) {
                    throw new ArchiveException("DOCX has duplicate entry " + name);
                }
            }
            log.debug("opened package: entries={}, compressed={} bytes", byName.size(), approxTotal);
            return new DocxArchive(zip, lim, byName, approxTotal);
        } catch (ArchiveException e) {
            try { zip.close(); } catch (IOException suppressed) { e.addSuppressed(suppressed); }
            throw e;
        }
    }

    /** 读取指定 part；不存在返回 null */
    public byte[] readPart(String path) throws ArchiveException {
        String name = normalize(path);
        byte[] cached = inflated.get(name);
        if (cached != null) return cached;

        ZipArchiveEntry entry = entries.get(name);
        if (entry == null) {
            // OPC 的 part 名大小写不敏感
            for (Map.Entry<String, ZipArchiveEntry> e : entries.entrySet()) {
                if (e.getKey().equalsIgnoreCase(name)) { entry = e.getValue(); break; }
            }
        }
        if (entry == null || entry.isDirectory()) return null;

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        long read = 0;
        try (InputStream in = zip.getInputStream(entry)) {
            byte[] buf = new byte[8192];
            int n;
            while ((n = in.read(buf)) != -1) {
                read += n;
                if (read > limits.maxEntrySize) {
                    throw new ArchiveException("DOCX entry " + name + " exceeds per-entry cap (" + limits.maxEntrySize + " bytes)");
                }
                if (inflatedTotal + read > limits.maxTotalUnzippedBytes) {
                    throw new ArchiveException("DOCX exceeds unzip cap (" + limits.maxTotalUnzippedBytes + " bytes)");
                }
                out.write(buf, 0, n);
            }
        } catch (IOException e) {
            throw new ArchiveException("Corrupt DOCX entry " + name + ": " + e.getMessage(), e);
        }
        inflatedTotal += read;
        byte[] bytes = out.toByteArray();
        inflated.put(name, bytes);
        return bytes;
    }

    public boolean hasPart(String path) {
        return entries.containsKey(normalize(path));
    }

    public List<String> partNames() {
        return new ArrayList<>(entries.keySet());
    }

    public int entryCount() { return entries.size(); }

    public long compressedSize() { return compressedTotal; }

    public long inflatedSize() { return inflatedTotal; }

    @Override
    public void close() throws IOException {
        zip.close();
    }

    private static String normalize(String path) {
        if (path == null) return "";
        String p = path.replace('\\', '/');
        while (p.startsWith("/")) p = p.substring(1);
        return p;
    }
}
