package site.respkv.command;

import lombok.Getter;
import site.respkv.database.WrongTypeException;
import site.respkv.protocol.ErrorKind;
import site.respkv.protocol.Errors;
import site.respkv.protocol.Resp;

/**
 * 命令解析或执行失败，调度器把它转换为错误回复，连接保持可用
 *
 * @since 1.0.0
 */
@Getter
public class CommandException extends RuntimeException {

    private final ErrorKind kind;

    public CommandException(final ErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public CommandException(final String message) {
        this(ErrorKind.ERR, message);
    }

    public Errors toErrors() {
        return new Errors(kind, getMessage());
    }

    /**
     * 把执行期异常转换为错误回复
     *
     * @param e 异常
     * @return 错误回复
     */
    public static Errors toReply(final RuntimeException e) {
        if (e instanceof CommandException) {
            return ((CommandException) e).toErrors();
        }
        if (e instanceof WrongTypeException) {
            return wrongType().toErrors();
        }
        return new Errors(ErrorKind.ERR, String.valueOf(e.getMessage()));
    }

    public static CommandException unknownCommand(final String name, final Resp[] array) {
        final StringBuilder sb = new StringBuilder("unknown command '").append(name)
                .append("', with args beginning with: ");
        for (int i = 1; i < array.length; i++) {
            sb.append('\'').append(array[i]).append("' ");
        }
        return new CommandException(sb.toString());
    }

    public static CommandException wrongArity(final String name) {
        return new CommandException("wrong number of arguments for '" + name.toLowerCase() + "' command");
    }

    public static CommandException wrongType() {
        return new CommandException(ErrorKind.WRONGTYPE, "Operation against a key holding the wrong kind of value");
    }

    public static CommandException notInteger() {
        return new CommandException("value is not an integer or out of range");
    }

    public static CommandException notFloat() {
        return new CommandException("value is not a valid float");
    }

    public static CommandException syntax() {
        return new CommandException("syntax error");
    }

    public static CommandException outOfRange(final String what) {
        return new CommandException(what + " is out of range");
    }

    public static CommandException overflow() {
        return new CommandException("increment or decrement would overflow");
    }

    public static CommandException readonly() {
        return new CommandException(ErrorKind.READONLY, "You can't write against a read only replica.");
    }

    public static CommandException nestedMulti() {
        return new CommandException("MULTI calls can not be nested");
    }

    public static CommandException withoutMulti(final String name) {
        return new CommandException(name + " without MULTI");
    }

    public static CommandException execAbort() {
        return new CommandException(ErrorKind.EXECABORT, "Transaction discarded because of previous errors.");
    }
}
