package site.respkv.internal;

/**
 * glob 风格的模式匹配，用于 KEYS 与 CONFIG GET。
 *
 * <p>支持的语法：
 * <ul>
 *   <li>{@code *} 匹配任意长度（含空）
 *   <li>{@code ?} 匹配单个字节
 *   <li>{@code [abc]}、{@code [^a]}、{@code [a-z]} 字符类
 *   <li>{@code \x} 转义
 * </ul>
 *
 * <p>直接在字节上匹配，不经过正则编译。
 *
 * @since 1.0.0
 */
public final class GlobMatcher {

    private GlobMatcher() {
        throw new UnsupportedOperationException("工具类不允许实例化");
    }

    /**
     * @param pattern 模式
     * @param text 被匹配的字节串
     * @param ignoreCase 是否忽略 ASCII 大小写
     * @return 是否匹配
     */
    public static boolean matches(final byte[] pattern, final byte[] text, final boolean ignoreCase) {
        return match(pattern, 0, text, 0, ignoreCase);
    }

    public static boolean matches(final byte[] pattern, final byte[] text) {
        return matches(pattern, text, false);
    }

    private static boolean match(final byte[] p, int pi, final byte[] s, int si, final boolean nocase) {
        while (pi < p.length) {
            final byte c = p[pi];
            switch (c) {
                case '*':
                    // 1. 合并连续的星号
                    while (pi + 1 < p.length && p[pi + 1] == '*') {
                        pi++;
                    }
                    if (pi + 1 == p.length) {
                        return true;
                    }
                    // 2. 回溯尝试每个可能的起点
                    for (int k = si; k <= s.length; k++) {
                        if (match(p, pi + 1, s, k, nocase)) {
                            return true;
                        }
                    }
                    return false;
                case '?':
                    if (si >= s.length) {
                        return false;
                    }
                    si++;
                    pi++;
                    break;
                case '[': {
                    if (si >= s.length) {
                        return false;
                    }
                    pi++;
                    final boolean negate = pi < p.length && p[pi] == '^';
                    if (negate) {
                        pi++;
                    }
                    boolean matched = false;
                    while (pi < p.length && p[pi] != ']') {
                        if (p[pi] == '\\' && pi + 1 < p.length) {
                            pi++;
                            matched |= equal(p[pi], s[si], nocase);
                            pi++;
                        } else if (pi + 2 < p.length && p[pi + 1] == '-' && p[pi + 2] != ']') {
                            int lo = p[pi] & 0xFF;
                            int hi = p[pi + 2] & 0xFF;
                            if (lo > hi) {
                                final int t = lo;
                                lo = hi;
                                hi = t;
                            }
                            int ch = s[si] & 0xFF;
                            if (nocase) {
                                ch = lower(ch);
                                lo = lower(lo);
                                hi = lower(hi);
                            }
                            matched |= ch >= lo && ch <= hi;
                            pi += 3;
                        } else {
                            matched |= equal(p[pi], s[si], nocase);
                            pi++;
                        }
                    }
                    // 未闭合的字符类视为到模式末尾
                    if (pi < p.length) {
                        pi++;
                    }
                    if (matched == negate) {
                        return false;
                    }
                    si++;
                    break;
                }
                case '\\':
                    if (pi + 1 < p.length) {
                        pi++;
                    }
                    // fall through
                default:
                    if (si >= s.length || !equal(p[pi], s[si], nocase)) {
                        return false;
                    }
                    si++;
                    pi++;
                    break;
            }
        }
        return si == s.length;
    }

    private static boolean equal(final byte a, final byte b, final boolean nocase) {
        if (a == b) {
            return true;
        }
        return nocase && lower(a & 0xFF) == lower(b & 0xFF);
    }

    private static int lower(final int c) {
        return c >= 'A' && c <= 'Z' ? c + 32 : c;
    }
}
