package site.respkv.command.impl.string;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisData;
import site.respkv.datastructure.RedisString;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.util.List;

/**
 * MGET key [key ...]，不存在或不是字符串的键返回空值
 */
public class Mget extends AbstractCommand {

    public Mget(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final List<RedisBytes> keys = keys();
        final Resp[] reply = new Resp[keys.size()];
        for (int i = 0; i < reply.length; i++) {
            final RedisData value = db.get(keys.get(i));
            reply[i] = value instanceof RedisString ? bulk(((RedisString) value).getValue()) : BulkString.NULL;
        }
        return new RespArray(reply);
    }
}
