package site.respkv.command.impl.set;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisSet;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * SUNION、SINTER、SDIFF，不存在的键视为空集合
 */
public class SetAlgebra extends AbstractCommand {

    public SetAlgebra(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        // 1. 收集操作数，类型不对时整个命令失败
        final List<Set<RedisBytes>> operands = new ArrayList<>();
        for (final RedisBytes key : keys()) {
            final RedisSet set = db.get(key, RedisType.SET);
            operands.add(set == null ? Collections.<RedisBytes>emptySet() : set.getMembers());
        }

        // 2. 计算
        final Set<RedisBytes> result = new LinkedHashSet<>(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            switch (type) {
                case SUNION:
                    result.addAll(operands.get(i));
                    break;
                case SINTER:
                    result.retainAll(operands.get(i));
                    break;
                default:
                    result.removeAll(operands.get(i));
                    break;
            }
        }

        final List<Resp> reply = new ArrayList<>(result.size());
        for (final RedisBytes member : result) {
            reply.add(bulk(member));
        }
        return RespArray.valueOf(reply);
    }
}
