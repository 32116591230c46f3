package site.respkv.rdb;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.respkv.core.KeyLockManager;
import site.respkv.core.RedisCore;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RDB持久化管理器
 *
 * <p>负责启动时加载、SAVE 同步保存和 BGSAVE 后台保存。
 * 两种保存都先在全部分段的共享锁下生成内存快照，
 * BGSAVE 只把写文件放到后台线程。文件先写临时文件再原子改名。
 *
 * @since 1.0.0
 */
@Slf4j
public class RdbManager {

    private final RedisCore redisCore;

    /** RDB文件 */
    @Getter
    private final File file;

    private final RdbWriter writer;

    private final RdbLoader loader;

    private final AtomicBoolean bgSaveInProgress = new AtomicBoolean(false);

    /** 最近一次成功保存的时间戳（秒） */
    @Getter
    private volatile long lastSaveTime;

    /** 后台保存线程 */
    private final ExecutorService bgSaveExecutor = Executors.newSingleThreadExecutor(r -> {
        final Thread thread = new Thread(r, "RDB-BGSave-Thread");
        thread.setDaemon(true);
        return thread;
    });

    /**
     * 构造函数
     *
     * @param redisCore Redis核心接口
     * @param dir 目录
     * @param fileName RDB文件名
     */
    public RdbManager(final RedisCore redisCore, final String dir, final String fileName) {
        this.redisCore = redisCore;
        this.file = new File(dir, fileName);
        this.writer = new RdbWriter(redisCore);
        this.loader = new RdbLoader(redisCore);
        log.info("RdbManager初始化完成，文件: {}", file.getAbsolutePath());
    }

    /**
     * 启动时从文件加载
     *
     * @return 加载的键数量
     * @throws IOException 文件损坏或读取失败
     */
    public int load() throws IOException {
        try (KeyLockManager.LockHandle ignored = redisCore.getLockManager().acquireAll(true)) {
            return loader.loadRdb(file);
        }
    }

    /**
     * 在全部分段的共享锁下生成快照
     *
     * @return 快照字节
     */
    public byte[] snapshot() {
        try (KeyLockManager.LockHandle ignored = redisCore.getLockManager().acquireAll(false)) {
            return writer.snapshot();
        }
    }

    /**
     * 用快照替换全部数据，复制的全量同步使用
     *
     * @param snapshot 快照字节
     * @return 加载的键数量
     */
    public int restore(final byte[] snapshot) throws IOException {
        try (KeyLockManager.LockHandle ignored = redisCore.getLockManager().acquireAll(true)) {
            return loader.restore(snapshot);
        }
    }

    /**
     * 同步保存（SAVE）
     *
     * @throws IOException 写文件失败
     */
    public void save() throws IOException {
        writeFile(snapshot());
    }

    /**
     * 后台保存（BGSAVE）
     *
     * @return 已有后台保存在进行时返回null，否则返回完成信号
     */
    public CompletableFuture<Boolean> bgSave() {
        if (!bgSaveInProgress.compareAndSet(false, true)) {
            return null;
        }
        final byte[] snapshot;
        try {
            snapshot = snapshot();
        } catch (RuntimeException e) {
            bgSaveInProgress.set(false);
            throw e;
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                writeFile(snapshot);
                return true;
            } catch (IOException e) {
                log.error("后台保存失败: {}", file.getAbsolutePath(), e);
                return false;
            } finally {
                bgSaveInProgress.set(false);
            }
        }, bgSaveExecutor);
    }

    public boolean isBgSaveInProgress() {
        return bgSaveInProgress.get();
    }

    private void writeFile(final byte[] snapshot) throws IOException {
        final Path target = file.toPath().toAbsolutePath();
        Files.createDirectories(target.getParent());
        final Path temp = target.resolveSibling("temp-" + ProcessHandle.current().pid() + "-"
                + Thread.currentThread().getId() + ".rdb");
        try (OutputStream out = Files.newOutputStream(temp)) {
            out.write(snapshot);
        }
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("文件系统不支持原子改名，改用普通替换: {}", e.getMessage());
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        lastSaveTime = System.currentTimeMillis() / 1000;
        log.info("快照已保存: {} ({} 字节)", target, snapshot.length);
    }

    /**
     * 关闭后台线程，等待正在进行的保存完成
     */
    public void close() {
        bgSaveExecutor.shutdown();
        try {
            if (!bgSaveExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("后台保存未在30秒内完成");
                bgSaveExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            bgSaveExecutor.shutdownNow();
        }
    }
}
