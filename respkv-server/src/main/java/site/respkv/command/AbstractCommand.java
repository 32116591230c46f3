package site.respkv.command;

import site.respkv.cluster.replication.PropagatedCommand;
import site.respkv.core.KeyLockManager;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisString;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 命令实现的公共基类：保存参数、按命令表计算键、提供参数解析工具和传播缓冲。
 *
 * <p>子类在 {@link #parse()} 中完成全部参数校验，
 * {@link #handle()} 先校验目标值的类型再修改数据，失败时数据保持原样。
 *
 * @since 1.0.0
 */
public abstract class AbstractCommand implements Command {

    protected final CommandType type;

    protected final RedisContext context;

    protected final ClientSession session;

    protected Resp[] args;

    private List<PropagatedCommand> propagated = Collections.emptyList();

    protected AbstractCommand(final CommandType type, final RedisContext context, final ClientSession session) {
        this.type = type;
        this.context = context;
        this.session = session;
    }

    @Override
    public CommandType getType() {
        return type;
    }

    @Override
    public final void setContext(final Resp[] array) {
        this.args = array;
        parse();
    }

    /**
     * 解析并校验 {@link #args}
     *
     * @throws CommandException 参数不合法
     */
    protected abstract void parse();

    @Override
    public List<RedisBytes> keys() {
        if (type.getFirstKey() <= 0) {
            return Collections.emptyList();
        }
        final int last = type.getLastKey() < 0 ? args.length + type.getLastKey() : type.getLastKey();
        final List<RedisBytes> keys = new ArrayList<>();
        for (int i = type.getFirstKey(); i <= last && i < args.length; i += type.getKeyStep()) {
            keys.add(arg(i));
        }
        return keys;
    }

    @Override
    public void collectLocks(final KeyLockManager.LockRequest request) {
        collectLocks(request, session.getDbIndex());
    }

    @Override
    public void collectLocks(final KeyLockManager.LockRequest request, final int dbIndex) {
        if (type.hasFlag(CommandFlag.GLOBAL)) {
            request.addAll(type.isWrite());
            return;
        }
        for (final RedisBytes key : keys()) {
            request.add(dbIndex, key, type.isWrite());
        }
    }

    @Override
    public List<PropagatedCommand> getPropagated() {
        return propagated;
    }

    /**
     * 记录一条传播命令，数据库取当前会话选中的库
     *
     * @param command 传播形式
     */
    protected void propagate(final RespArray command) {
        if (propagated.isEmpty()) {
            propagated = new ArrayList<>(2);
        }
        propagated.add(new PropagatedCommand(session.getDbIndex(), command));
    }

    protected void propagateAll(final List<PropagatedCommand> commands) {
        if (commands.isEmpty()) {
            return;
        }
        if (propagated.isEmpty()) {
            propagated = new ArrayList<>(commands.size());
        }
        propagated.addAll(commands);
    }

    /**
     * 按原样传播本命令
     */
    protected void propagateAsIs() {
        propagate(new RespArray(args));
    }

    protected RedisDB db() {
        return context.getRedisCore().getDB(session.getDbIndex());
    }

    protected RedisBytes arg(final int index) {
        return ((BulkString) args[index]).getContent();
    }

    protected String argString(final int index) {
        return arg(index).getString();
    }

    protected boolean argIs(final int index, final String option) {
        return arg(index).equalsIgnoreCase(option);
    }

    protected long parseLong(final int index) {
        return parseLong(arg(index));
    }

    protected static long parseLong(final RedisBytes bytes) {
        try {
            return RedisString.parseStrictLong(bytes);
        } catch (NumberFormatException e) {
            throw CommandException.notInteger();
        }
    }

    protected double parseDouble(final int index) {
        return parseDouble(arg(index));
    }

    /**
     * 解析浮点数，接受 inf、+inf、-inf，拒绝 NaN
     */
    protected static double parseDouble(final RedisBytes bytes) {
        final String text = bytes.getString().trim();
        if ("inf".equalsIgnoreCase(text) || "+inf".equalsIgnoreCase(text)) {
            return Double.POSITIVE_INFINITY;
        }
        if ("-inf".equalsIgnoreCase(text)) {
            return Double.NEGATIVE_INFINITY;
        }
        try {
            final double value = Double.parseDouble(text);
            if (Double.isNaN(value) || text.isEmpty() || Character.isLetter(text.charAt(text.length() - 1))) {
                throw CommandException.notFloat();
            }
            return value;
        } catch (NumberFormatException e) {
            throw CommandException.notFloat();
        }
    }

    /**
     * 构造传播或回复用的命令数组
     */
    protected static RespArray commandOf(final Object... parts) {
        final Resp[] array = new Resp[parts.length];
        for (int i = 0; i < parts.length; i++) {
            final Object part = parts[i];
            if (part instanceof RedisBytes) {
                array[i] = new BulkString((RedisBytes) part);
            } else {
                array[i] = BulkString.fromString(String.valueOf(part));
            }
        }
        return new RespArray(array);
    }

    /**
     * 以Redis的方式格式化浮点数：整数值不带小数点，其余取最短表示，
     * 十进制指数小于-4或不小于17时用科学计数法（如 1e+20、1.5e-07）
     */
    protected static String formatDouble(final double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0) {
            return 1 / value < 0 ? "-0" : "0";
        }
        if (value == Math.rint(value) && Math.abs(value) <= Long.MAX_VALUE / 2) {
            return Long.toString((long) value);
        }
        final BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        final int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent >= -4 && exponent < 17) {
            return decimal.toPlainString();
        }
        final String digits = decimal.unscaledValue().abs().toString();
        final StringBuilder sb = new StringBuilder(digits.length() + 8);
        if (decimal.signum() < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? '-' : '+');
        final int abs = Math.abs(exponent);
        if (abs < 10) {
            sb.append('0');
        }
        return sb.append(abs).toString();
    }

    protected static BulkString bulk(final RedisBytes value) {
        return BulkString.create(value);
    }
}
