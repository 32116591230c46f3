package site.respkv.command.impl.string;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisString;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Append extends AbstractCommand {

    public Append(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final RedisBytes key = arg(1);
        final RedisString current = db.get(key, RedisType.STRING);
        final int length;
        if (current == null) {
            db.put(key, new RedisString(arg(2)));
            length = arg(2).length();
        } else {
            length = current.append(arg(2));
            db.touch(key);
        }
        propagateAsIs();
        return RespInteger.valueOf(length);
    }
}
