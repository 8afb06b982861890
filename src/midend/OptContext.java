package midend;

import java.util.EnumSet;
import java.util.Set;

/**
 * 一次优化的配置和计数: 打开了哪些 pass, 一共改写了多少次
 */
public class OptContext {
    private final EnumSet<OptPass> enabled;
    private int applied = 0;

    public OptContext(Set<OptPass> passes) {
        this.enabled = passes.isEmpty() ? EnumSet.noneOf(OptPass.class) : EnumSet.copyOf(passes);
    }

    public OptContext(OptPass first, OptPass... rest) {
        this.enabled = EnumSet.of(first, rest);
    }

    public static OptContext all() {
        return new OptContext(OptPass.ALL);
    }

    public static OptContext none() {
        return new OptContext(EnumSet.noneOf(OptPass.class));
    }

    public boolean isEnabled(OptPass pass) {
        return enabled.contains(pass) || enabled.contains(OptPass.ALL);
    }

    public void enable(OptPass pass) {
        enabled.add(pass);
    }

    public void disable(OptPass pass) {
        if (enabled.remove(OptPass.ALL)) {
            enabled.add(OptPass.CONSTANT_FOLDING);
            enabled.add(OptPass.DEAD_CODE_ELIMINATION);
        }
        enabled.remove(pass);
    }

    void applied() {
        applied++;
    }

    public int getApplied() {
        return applied;
    }

    public void reset() {
        applied = 0;
    }
}
