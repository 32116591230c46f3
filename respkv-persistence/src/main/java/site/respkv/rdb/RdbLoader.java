package site.respkv.rdb;

import lombok.extern.slf4j.Slf4j;
import site.respkv.core.RedisCore;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisData;
import site.respkv.rdb.crc.Crc64InputStream;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RDB快照加载器
 *
 * <p>先把整个快照解析到暂存区并校验CRC64，全部通过后才清空 RedisCore 并写入，
 * 快照损坏时现有数据保持不变。已过期的键直接跳过。调用方负责持有全部分段的独占锁。
 *
 * @since 1.0.0
 */
@Slf4j
public class RdbLoader {

    private final RedisCore redisCore;

    public RdbLoader(final RedisCore redisCore) {
        this.redisCore = redisCore;
    }

    /**
     * 从内存中的快照恢复
     *
     * @param snapshot 快照字节
     * @return 加载的键数量
     * @throws IOException 快照不合法
     */
    public int restore(final byte[] snapshot) throws IOException {
        return load(new ByteArrayInputStream(snapshot));
    }

    /**
     * 加载RDB文件，文件不存在时视为空数据库
     *
     * @param file RDB文件
     * @return 加载的键数量
     * @throws IOException 读取失败或文件不合法
     */
    public int loadRdb(final File file) throws IOException {
        if (!file.exists()) {
            log.info("RDB文件不存在，以空数据库启动: {}", file.getAbsolutePath());
            return 0;
        }
        try (InputStream in = new BufferedInputStream(new FileInputStream(file))) {
            final int keys = load(in);
            log.info("RDB文件加载成功，共 {} 个键: {}", keys, file.getAbsolutePath());
            return keys;
        }
    }

    /**
     * 从输入流加载快照
     *
     * @param inputStream 输入流，不会被关闭
     * @return 加载的键数量
     */
    public int load(final InputStream inputStream) throws IOException {
        final Crc64InputStream crcStream = new Crc64InputStream(inputStream);
        final DataInputStream dis = new DataInputStream(crcStream);

        // 1. 检查头部
        RdbUtils.checkRdbHeader(dis);

        // 2. 解析到暂存区
        final List<Map<RedisBytes, RedisData>> staged = loadAllDatabases(dis);

        // 3. 验证CRC64校验和
        RdbUtils.verifyCrc64Checksum(crcStream);

        // 4. 校验通过后替换全部数据
        redisCore.flushAll();
        int keys = 0;
        for (int i = 0; i < staged.size(); i++) {
            final RedisDB db = redisCore.getDB(i);
            for (final Map.Entry<RedisBytes, RedisData> entry : staged.get(i).entrySet()) {
                db.put(entry.getKey(), entry.getValue());
                keys++;
            }
        }
        return keys;
    }

    private List<Map<RedisBytes, RedisData>> loadAllDatabases(final DataInputStream dis) throws IOException {
        final long now = System.currentTimeMillis();
        final List<Map<RedisBytes, RedisData>> staged = new ArrayList<>(redisCore.getDBNum());
        for (int i = 0; i < redisCore.getDBNum(); i++) {
            staged.add(new LinkedHashMap<>());
        }
        Map<RedisBytes, RedisData> db = staged.get(0);
        long expireAt = -1;
        while (true) {
            final byte opcode = dis.readByte();
            switch (opcode) {
                case RdbConstants.RDB_OPCODE_EOF:
                    return staged;
                case RdbConstants.RDB_OPCODE_SELECTDB:
                    final int dbIndex = RdbUtils.readLength(dis);
                    if (dbIndex >= redisCore.getDBNum()) {
                        throw new RdbFormatException("database index out of range: " + dbIndex);
                    }
                    db = staged.get(dbIndex);
                    break;
                case RdbConstants.RDB_OPCODE_EXPIRETIME_MS:
                    expireAt = RdbUtils.readExpireTime(dis);
                    break;
                default:
                    final RedisBytes key = RdbUtils.readString(dis);
                    final RedisData value = RdbUtils.loadValue(dis, opcode);
                    if (expireAt >= 0 && expireAt <= now) {
                        log.debug("跳过已过期的键: {}", key);
                    } else {
                        value.setExpireAt(expireAt);
                        db.put(key, value);
                    }
                    expireAt = -1;
                    break;
            }
        }
    }
}
