package site.respkv.rdb;

import lombok.extern.slf4j.Slf4j;
import site.respkv.core.RedisCore;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisData;
import site.respkv.rdb.crc.Crc64OutputStream;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * RDB快照写入器
 *
 * <p>把全部数据库序列化为一个快照。调用方负责在序列化期间持有
 * 全部分段的共享锁，使快照对每个键只反映一个一致的版本。
 *
 * @since 1.0.0
 */
@Slf4j
public class RdbWriter {

    private final RedisCore redisCore;

    public RdbWriter(final RedisCore redisCore) {
        this.redisCore = redisCore;
    }

    /**
     * 生成内存中的快照
     *
     * @return 快照字节
     */
    public byte[] snapshot() {
        final ByteArrayOutputStream buffer = new ByteArrayOutputStream(4096);
        try {
            writeTo(buffer);
        } catch (IOException e) {
            // 内存流不会产生IO错误
            throw new UncheckedIOException(e);
        }
        return buffer.toByteArray();
    }

    /**
     * 将快照写入输出流
     *
     * @param outputStream 目标流，不会被关闭
     * @return 写入的键数量
     */
    public int writeTo(final OutputStream outputStream) throws IOException {
        final Crc64OutputStream crcStream = new Crc64OutputStream(outputStream);
        final DataOutputStream dos = new DataOutputStream(crcStream);
        final long now = System.currentTimeMillis();
        int keys = 0;

        // 1. 文件头
        RdbUtils.writeRdbHeader(dos);

        // 2. 逐库写入，空库和过期键跳过
        for (final RedisDB db : redisCore.getDataBases()) {
            if (db.size() == 0) {
                continue;
            }
            boolean selected = false;
            for (final Map.Entry<RedisBytes, RedisData> entry : db.getData().entrySet()) {
                final RedisData value = entry.getValue();
                if (value.isExpired(now)) {
                    continue;
                }
                if (!selected) {
                    RdbUtils.writeSelectDB(dos, db.getId());
                    selected = true;
                }
                RdbUtils.saveEntry(dos, entry.getKey(), value);
                keys++;
            }
        }

        // 3. EOF与校验和
        dos.flush();
        RdbUtils.writeRdbFooter(crcStream);
        crcStream.flush();
        log.debug("快照写入完成，共 {} 个键", keys);
        return keys;
    }
}
