package site.respkv.cluster.replication;

import lombok.Getter;
import site.respkv.protocol.RespArray;

/**
 * 待传播的命令及其所在的数据库
 *
 * @since 1.0.0
 */
@Getter
public class PropagatedCommand {

    private final int dbIndex;

    private final RespArray command;

    public PropagatedCommand(final int dbIndex, final RespArray command) {
        this.dbIndex = dbIndex;
        this.command = command;
    }
}
