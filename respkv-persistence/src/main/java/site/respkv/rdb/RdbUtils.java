package site.respkv.rdb;

import lombok.extern.slf4j.Slf4j;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisData;
import site.respkv.datastructure.RedisHash;
import site.respkv.datastructure.RedisList;
import site.respkv.datastructure.RedisSet;
import site.respkv.datastructure.RedisString;
import site.respkv.datastructure.RedisZset;
import site.respkv.rdb.crc.Crc64InputStream;
import site.respkv.rdb.crc.Crc64OutputStream;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * RDB文件操作工具类
 *
 * <p>提供快照读写的底层方法：文件头尾、长度编码、各数据类型的序列化与反序列化。
 *
 * <p>长度编码与 Redis 一致：
 * <ul>
 *     <li>0-63: 1字节，高2位为00</li>
 *     <li>64-16383: 2字节，高2位为01</li>
 *     <li>其他: 首字节0x80加4字节大端整数</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Slf4j
public final class RdbUtils {

    private RdbUtils() {
        throw new UnsupportedOperationException("工具类不允许实例化");
    }

    /**
     * 写入RDB文件头部
     */
    public static void writeRdbHeader(final DataOutputStream dos) throws IOException {
        dos.write(RdbConstants.RDB_HEADER.getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * 写入EOF标记和CRC64校验和，EOF计入校验和，校验和本身不计入
     *
     * @param crc64OutputStream CRC64输出流
     */
    public static void writeRdbFooter(final Crc64OutputStream crc64OutputStream) throws IOException {
        // 1. 写入EOF标记
        crc64OutputStream.write(RdbConstants.RDB_OPCODE_EOF & 0xFF);

        // 2. 写入CRC64校验和（小端序，8字节）
        crc64OutputStream.writeCrc64Checksum();
        log.debug("RDB尾部写入完成，CRC64校验和: 0x{}", Long.toHexString(crc64OutputStream.getCrc64()));
    }

    /**
     * 检查RDB文件头部
     *
     * @throws RdbFormatException 文件头不正确
     */
    public static void checkRdbHeader(final DataInputStream dis) throws IOException {
        final byte[] header = new byte[RdbConstants.RDB_HEADER.length()];
        dis.readFully(header);
        final String actual = new String(header, StandardCharsets.US_ASCII);
        if (!actual.startsWith("REDIS")) {
            throw new RdbFormatException("bad RDB header: " + actual);
        }
        if (!RdbConstants.RDB_HEADER.equals(actual)) {
            log.warn("RDB版本号不同，按当前格式尝试读取: {}", actual);
        }
    }

    /**
     * 读取文件末尾的校验和并与计算值比较
     *
     * @throws RdbFormatException 校验失败
     */
    public static void verifyCrc64Checksum(final Crc64InputStream crc64InputStream) throws IOException {
        final long actualChecksum = crc64InputStream.getCrc64();
        final long expectedChecksum = crc64InputStream.readCrc64Checksum();
        if (expectedChecksum != actualChecksum) {
            log.error("CRC64校验失败! 期望: 0x{}, 实际: 0x{}",
                    Long.toHexString(expectedChecksum), Long.toHexString(actualChecksum));
            throw new RdbFormatException("RDB checksum mismatch");
        }
        log.debug("CRC64校验成功: 0x{}", Long.toHexString(actualChecksum));
    }

    public static void writeSelectDB(final DataOutputStream dos, final int databaseId) throws IOException {
        dos.writeByte(RdbConstants.RDB_OPCODE_SELECTDB);
        writeLength(dos, databaseId);
    }

    /**
     * 写入毫秒过期时间，8字节小端序
     */
    public static void writeExpireTime(final DataOutputStream dos, final long expireAt) throws IOException {
        dos.writeByte(RdbConstants.RDB_OPCODE_EXPIRETIME_MS);
        dos.writeLong(Long.reverseBytes(expireAt));
    }

    public static long readExpireTime(final DataInputStream dis) throws IOException {
        return Long.reverseBytes(dis.readLong());
    }

    /**
     * 写入长度编码
     *
     * @param dos 数据输出流
     * @param length 非负长度
     */
    public static void writeLength(final DataOutputStream dos, final int length) throws IOException {
        if (length < 0) {
            throw new IllegalArgumentException("negative length: " + length);
        }
        if (length < 0x40) {
            dos.writeByte(length);
        } else if (length < 0x4000) {
            dos.writeByte(0x40 | (length >>> 8));
            dos.writeByte(length & 0xFF);
        } else {
            dos.writeByte(0x80);
            dos.writeInt(length);
        }
    }

    /**
     * 读取长度编码
     *
     * @return 长度
     * @throws RdbFormatException 编码类型不支持
     */
    public static int readLength(final DataInputStream dis) throws IOException {
        final int firstByte = dis.readUnsignedByte();
        final int type = (firstByte & 0xC0) >> 6;
        switch (type) {
            case RdbConstants.LEN_6BIT:
                return firstByte & 0x3F;
            case RdbConstants.LEN_14BIT:
                return ((firstByte & 0x3F) << 8) | dis.readUnsignedByte();
            case RdbConstants.LEN_32BIT:
                final int length = dis.readInt();
                if (length < 0) {
                    throw new RdbFormatException("length out of range: " + length);
                }
                return length;
            default:
                throw new RdbFormatException("unsupported length encoding: 0x" + Integer.toHexString(firstByte));
        }
    }

    public static void writeString(final DataOutputStream dos, final byte[] bytes) throws IOException {
        writeLength(dos, bytes.length);
        dos.write(bytes);
    }

    public static RedisBytes readString(final DataInputStream dis) throws IOException {
        final byte[] bytes = new byte[readLength(dis)];
        dis.readFully(bytes);
        return RedisBytes.wrapTrusted(bytes);
    }

    /**
     * 写入一个键值对：可选的过期时间、类型标识、键、值
     *
     * @param dos 数据输出流
     * @param key 键
     * @param value 值
     */
    public static void saveEntry(final DataOutputStream dos, final RedisBytes key, final RedisData value)
            throws IOException {
        if (value.expireAt() >= 0) {
            writeExpireTime(dos, value.expireAt());
        }
        switch (value.type()) {
            case STRING:
                dos.writeByte(RdbConstants.STRING_TYPE);
                writeString(dos, key.getBytesUnsafe());
                writeString(dos, ((RedisString) value).getValue().getBytesUnsafe());
                break;
            case LIST:
                dos.writeByte(RdbConstants.LIST_TYPE);
                writeString(dos, key.getBytesUnsafe());
                saveList(dos, (RedisList) value);
                break;
            case SET:
                dos.writeByte(RdbConstants.SET_TYPE);
                writeString(dos, key.getBytesUnsafe());
                saveSet(dos, (RedisSet) value);
                break;
            case ZSET:
                dos.writeByte(RdbConstants.ZSET_TYPE);
                writeString(dos, key.getBytesUnsafe());
                saveZset(dos, (RedisZset) value);
                break;
            case HASH:
                dos.writeByte(RdbConstants.HASH_TYPE);
                writeString(dos, key.getBytesUnsafe());
                saveHash(dos, (RedisHash) value);
                break;
            default:
                throw new IllegalStateException("unknown value type: " + value.type());
        }
    }

    /**
     * 按类型标识读取值，键已由调用方读取
     *
     * @param dis 数据输入流
     * @param type 类型标识
     * @return 值
     * @throws RdbFormatException 未知类型
     */
    public static RedisData loadValue(final DataInputStream dis, final byte type) throws IOException {
        switch (type) {
            case RdbConstants.STRING_TYPE:
                return new RedisString(readString(dis));
            case RdbConstants.LIST_TYPE:
                return loadList(dis);
            case RdbConstants.SET_TYPE:
                return loadSet(dis);
            case RdbConstants.ZSET_TYPE:
                return loadZset(dis);
            case RdbConstants.HASH_TYPE:
                return loadHash(dis);
            default:
                throw new RdbFormatException("unknown value type: " + (type & 0xFF));
        }
    }

    private static void saveList(final DataOutputStream dos, final RedisList value) throws IOException {
        writeLength(dos, value.size());
        for (final RedisBytes element : value.getAll()) {
            writeString(dos, element.getBytesUnsafe());
        }
    }

    private static RedisList loadList(final DataInputStream dis) throws IOException {
        final int size = readLength(dis);
        final RedisList redisList = new RedisList();
        for (int i = 0; i < size; i++) {
            redisList.rpush(readString(dis));
        }
        return redisList;
    }

    private static void saveSet(final DataOutputStream dos, final RedisSet value) throws IOException {
        writeLength(dos, value.size());
        for (final RedisBytes member : value.getMembers()) {
            writeString(dos, member.getBytesUnsafe());
        }
    }

    private static RedisSet loadSet(final DataInputStream dis) throws IOException {
        final int size = readLength(dis);
        final RedisSet redisSet = new RedisSet();
        for (int i = 0; i < size; i++) {
            redisSet.add(readString(dis));
        }
        return redisSet;
    }

    private static void saveHash(final DataOutputStream dos, final RedisHash value) throws IOException {
        writeLength(dos, value.size());
        for (final Map.Entry<RedisBytes, RedisBytes> entry : value.getHash().entrySet()) {
            writeString(dos, entry.getKey().getBytesUnsafe());
            writeString(dos, entry.getValue().getBytesUnsafe());
        }
    }

    private static RedisHash loadHash(final DataInputStream dis) throws IOException {
        final int size = readLength(dis);
        final RedisHash redisHash = new RedisHash();
        for (int i = 0; i < size; i++) {
            final RedisBytes field = readString(dis);
            redisHash.put(field, readString(dis));
        }
        return redisHash;
    }

    /**
     * 有序集合按成员、分数字符串的顺序写入
     */
    private static void saveZset(final DataOutputStream dos, final RedisZset value) throws IOException {
        writeLength(dos, value.size());
        for (final Map.Entry<RedisBytes, Double> entry : value.getMemberScores().entrySet()) {
            writeString(dos, entry.getKey().getBytesUnsafe());
            writeString(dos, Double.toString(entry.getValue()).getBytes(StandardCharsets.US_ASCII));
        }
    }

    private static RedisZset loadZset(final DataInputStream dis) throws IOException {
        final int size = readLength(dis);
        final RedisZset redisZset = new RedisZset();
        for (int i = 0; i < size; i++) {
            final RedisBytes member = readString(dis);
            final String score = readString(dis).getString();
            try {
                redisZset.add(Double.parseDouble(score), member);
            } catch (NumberFormatException e) {
                throw new RdbFormatException("bad zset score: " + score);
            }
        }
        return redisZset;
    }
}
