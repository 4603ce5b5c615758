package com.afsun.sqldiagram.core.extract;

import com.afsun.sqldiagram.core.util.IdentifierCanonicalizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 阶段级作用域：维护别名到规范名的映射，并收集对其他阶段的依赖。
 * <p>
 * 别名映射与依赖收集由两个访问器分别完成，共享同一个作用域。
 */
public class StageScope {

    // 全部阶段：规范名 -> 原始名
    private final Map<String, String> stageNames;
    // 当前阶段自身的规范名，可为 null
    private final String self;
    private final Map<String, String> alias2Canonical = new LinkedHashMap<>();
    private final Set<String> dependencies = new LinkedHashSet<>();

    public StageScope(Map<String, String> stageNames, String self) {
        this.stageNames = stageNames == null ? Collections.<String, String>emptyMap() : stageNames;
        this.self = self;
    }

    // 添加别名映射，别名与规范名均需非空
    public void addAlias(String alias, String canonical) {
        String key = IdentifierCanonicalizer.canonicalize(alias);
        if (key != null && canonical != null) {
            alias2Canonical.put(key, canonical);
        }
    }

    /**
     * 解析限定符：先查别名，再按规范名本身处理
     */
    public String resolve(String qualifier) {
        String key = IdentifierCanonicalizer.canonicalize(qualifier);
        if (key == null) {
            return null;
        }
        String mapped = alias2Canonical.get(key);
        return mapped != null ? mapped : key;
    }

    /**
     * 记录依赖：只接受已知阶段名，排除自身
     *
     * @return 是否为新增依赖
     */
    public boolean addDependency(String canonical) {
        if (canonical == null || canonical.equals(self) || !stageNames.containsKey(canonical)) {
            return false;
        }
        return dependencies.add(canonical);
    }

    public Set<String> getDependencies() {
        return Collections.unmodifiableSet(dependencies);
    }
}
