package site.respkv.command;

import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * 命令实例工厂，每次执行创建一个新实例
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommandFactory {

    Command create(CommandType type, RedisContext context, ClientSession session);
}
