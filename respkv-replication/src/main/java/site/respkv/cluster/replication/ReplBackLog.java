package site.respkv.cluster.replication;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 复制积压缓冲区
 *
 * <p>固定大小的环形缓冲区，保存最近传播的字节流。偏移量按字节计数，
 * 缓冲区覆盖 [startOffset, endOffset)，endOffset 即主节点的复制偏移量。
 * 从节点的偏移量落在该区间内时可以部分同步。
 *
 * @since 1.0.0
 */
@Slf4j
public class ReplBackLog {

    /** 默认缓冲区大小1MB */
    public static final int DEFAULT_BACKLOG_SIZE = 1024 * 1024;

    private final byte[] buffer;

    @Getter
    private final int bufferSize;

    /** 缓冲区中最早字节的偏移量 */
    private long startOffset;

    /** 下一个写入字节的偏移量 */
    private long endOffset;

    public ReplBackLog(final int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("backlog size must be positive: " + bufferSize);
        }
        this.buffer = new byte[bufferSize];
        this.bufferSize = bufferSize;
    }

    public ReplBackLog() {
        this(DEFAULT_BACKLOG_SIZE);
    }

    /**
     * 追加字节，超出容量时覆盖最早的数据
     *
     * @param data 已编码的命令
     * @return 追加后的结束偏移量
     */
    public synchronized long append(final byte[] data) {
        final int length = data.length;
        // 1. 超过容量时只保留尾部
        int from = 0;
        int count = length;
        if (count > bufferSize) {
            from = length - bufferSize;
            count = bufferSize;
        }

        // 2. 环形写入，可能分两段
        final int pos = (int) ((endOffset + from) % bufferSize);
        final int firstPart = Math.min(count, bufferSize - pos);
        System.arraycopy(data, from, buffer, pos, firstPart);
        if (count > firstPart) {
            System.arraycopy(data, from + firstPart, buffer, 0, count - firstPart);
        }

        // 3. 更新区间
        endOffset += length;
        startOffset = Math.max(startOffset, endOffset - bufferSize);
        return endOffset;
    }

    /**
     * @param offset 从节点已处理的偏移量
     * @return 偏移量仍在缓冲区覆盖范围内时返回true
     */
    public synchronized boolean contains(final long offset) {
        return offset >= startOffset && offset <= endOffset;
    }

    /**
     * 读取从给定偏移量到末尾的全部字节
     *
     * @param offset 起始偏移量
     * @return 字节副本
     * @throws IllegalArgumentException 偏移量不在缓冲区内
     */
    public synchronized byte[] readFrom(final long offset) {
        if (!contains(offset)) {
            throw new IllegalArgumentException("offset " + offset + " not in backlog ["
                    + startOffset + ", " + endOffset + "]");
        }
        final int length = (int) (endOffset - offset);
        final byte[] result = new byte[length];
        final int pos = (int) (offset % bufferSize);
        final int firstPart = Math.min(length, bufferSize - pos);
        System.arraycopy(buffer, pos, result, 0, firstPart);
        if (length > firstPart) {
            System.arraycopy(buffer, 0, result, firstPart, length - firstPart);
        }
        return result;
    }

    public synchronized long getStartOffset() {
        return startOffset;
    }

    public synchronized long getEndOffset() {
        return endOffset;
    }

    /**
     * 缓冲区中保存的字节数
     */
    public synchronized long getHistoryLength() {
        return endOffset - startOffset;
    }
}
