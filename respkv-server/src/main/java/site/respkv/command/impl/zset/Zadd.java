package site.respkv.command.impl.zset;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisType;
import site.respkv.datastructure.RedisZset;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * ZADD key score member [score member ...]，返回新增成员数
 */
public class Zadd extends AbstractCommand {

    private double[] scores;

    public Zadd(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        if (args.length % 2 != 0) {
            throw CommandException.syntax();
        }
        scores = new double[(args.length - 2) / 2];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = parseDouble(2 + i * 2);
        }
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final RedisBytes key = arg(1);
        RedisZset zset = db.get(key, RedisType.ZSET);
        final boolean created = zset == null;
        if (created) {
            zset = new RedisZset();
        }
        int added = 0;
        for (int i = 0; i < scores.length; i++) {
            if (zset.add(scores[i], arg(3 + i * 2))) {
                added++;
            }
        }
        if (created) {
            db.put(key, zset);
        } else {
            db.touch(key);
        }
        propagateAsIs();
        return RespInteger.valueOf(added);
    }
}
