package xyz.vvrf.gds.core;

import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 结构化类型比较所用的签名分词工具。
 * <p>
 * 类型检查不要求端口名与连线标签完全相等，而是把签名拆成规范化的 token 集合，
 * 再比较集合间的包含 / 相交关系。
 * </p>
 * 分词规则：按 {@code ,} 或 {@code +} 切分，去除首尾空白，转小写，丢弃空串。
 *
 * @author ruifeng.wen
 */
public final class Tokens {

    private static final Pattern SEPARATORS = Pattern.compile("[,+]");

    private Tokens() {}

    /**
     * 将签名字符串规范化为不可变 token 集合。
     *
     * @param signature 签名文本 (null 视为空串)
     * @return 不可变 token 集合，可能为空
     */
    public static Set<String> tokenize(String signature) {
        if (signature == null || signature.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> tokens = new HashSet<>();
        for (String part : SEPARATORS.split(signature)) {
            String normalized = part.trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty()) {
                tokens.add(normalized);
            }
        }
        return Collections.unmodifiableSet(tokens);
    }

    /**
     * child 的每个 token 是否都出现在 parent 中。
     * child 为空时恒为 true (空真)。
     */
    public static boolean subset(String child, String parent) {
        return subset(tokenize(child), tokenize(parent));
    }

    public static boolean subset(Set<String> child, Set<String> parent) {
        if (child.isEmpty()) {
            return true;
        }
        return parent.containsAll(child);
    }

    /**
     * a 与 b 是否至少共享一个 token。任一侧为空时为 false。
     */
    public static boolean overlap(String a, String b) {
        return overlap(tokenize(a), tokenize(b));
    }

    public static boolean overlap(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        for (String token : a) {
            if (b.contains(token)) {
                return true;
            }
        }
        return false;
    }
}
