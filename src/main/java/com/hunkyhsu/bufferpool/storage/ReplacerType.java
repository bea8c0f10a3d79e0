package com.hunkyhsu.bufferpool.storage;

/**
 * 可选的页面替换策略
 */
public enum ReplacerType {
    LRU {
        @Override
        public Replacer create(int capacity) {
            return new LRUReplacer(capacity);
        }
    },
    CLOCK {
        @Override
        public Replacer create(int capacity) {
            return new ClockReplacer(capacity);
        }
    };

    public abstract Replacer create(int capacity);

    /**
     * 忽略大小写解析策略名
     */
    public static ReplacerType fromName(String name) {
        for (ReplacerType type : values()) {
            if (type.name().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported replacement strategy: " + name);
    }
}
