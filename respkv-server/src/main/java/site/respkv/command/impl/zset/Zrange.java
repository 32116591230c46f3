package site.respkv.command.impl.zset;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisType;
import site.respkv.datastructure.RedisZset;
import site.respkv.internal.SkipList;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.util.ArrayList;
import java.util.List;

/**
 * ZRANGE key start stop [WITHSCORES]
 */
public class Zrange extends AbstractCommand {

    private long start;

    private long stop;

    private boolean withScores;

    public Zrange(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        start = parseLong(2);
        stop = parseLong(3);
        if (args.length == 5) {
            if (!argIs(4, "WITHSCORES")) {
                throw CommandException.syntax();
            }
            withScores = true;
        }
    }

    @Override
    public Resp handle() {
        final RedisZset zset = db().get(arg(1), RedisType.ZSET);
        if (zset == null) {
            return RespArray.EMPTY;
        }
        return toReply(zset.rangeByRank(start, stop), withScores);
    }

    static RespArray toReply(final List<SkipList.SkipListNode<RedisBytes>> nodes, final boolean withScores) {
        final List<Resp> reply = new ArrayList<>(withScores ? nodes.size() * 2 : nodes.size());
        for (final SkipList.SkipListNode<RedisBytes> node : nodes) {
            reply.add(bulk(node.member));
            if (withScores) {
                reply.add(BulkString.fromString(formatDouble(node.score)));
            }
        }
        return RespArray.valueOf(reply);
    }
}
