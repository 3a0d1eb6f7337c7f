package org.cachebust.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * 有上限的告警列表。
 * <p>
 * 避免 warnings 因为“跳过大量文件”而膨胀到非常大（反过来又导致报告被截断）。
 * 非线程安全：每个工作线程持有自己的实例，汇总时再通过 {@link #addAll(LimitedWarnings)} 合并。
 */
public final class LimitedWarnings {

    private final int maxWarnings;
    private final List<String> messages = new ArrayList<>();
    private int dropped;

    public LimitedWarnings(int maxWarnings) {
        this.maxWarnings = Math.max(1, maxWarnings);
    }

    public void add(String message) {
        if (message == null) {
            return;
        }
        if (messages.size() < maxWarnings) {
            messages.add(message);
        } else {
            dropped++;
        }
    }

    public void addAll(LimitedWarnings other) {
        if (other == null) {
            return;
        }
        for (String message : other.messages) {
            add(message);
        }
        dropped += other.dropped;
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public List<String> toList() {
        if (dropped == 0) {
            return List.copyOf(messages);
        }
        List<String> result = new ArrayList<>(messages);
        result.add("告警过多，已省略后续 " + dropped + " 条告警…");
        return List.copyOf(result);
    }
}
