package com.afsun.sqldiagram.core.extract.visitor;

import com.afsun.sqldiagram.core.extract.StageScope;
import com.afsun.sqldiagram.core.util.IdentifierCanonicalizer;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.ast.expr.SQLPropertyExpr;
import com.alibaba.druid.sql.visitor.SQLASTVisitorAdapter;
import lombok.extern.slf4j.Slf4j;

/**
 * 收集阶段对其他阶段的依赖。
 * <p>
 * 表引用（含派生表、JOIN 目标、任意深度的子查询）按规范名匹配；
 * 限定列 t.col 的限定符经别名映射后匹配。非阶段名（基表）忽略。
 *
 * @author afsun
 */
@Slf4j
public class DependencyCollectingVisitor extends SQLASTVisitorAdapter {

    private final StageScope scope;

    public DependencyCollectingVisitor(StageScope scope) {
        this.scope = scope;
    }

    @Override
    public boolean visit(SQLExprTableSource x) {
        String canonical = IdentifierCanonicalizer.extractIdentifier(x);
        if (scope.addDependency(canonical)) {
            log.debug("表引用依赖: {}", canonical);
        }
        return false;
    }

    @Override
    public boolean visit(SQLPropertyExpr x) {
        if (x.getOwner() == null) {
            return false;
        }
        String qualifier = IdentifierCanonicalizer.extractRawIdentifier(x.getOwner());
        String canonical = scope.resolve(qualifier);
        if (scope.addDependency(canonical)) {
            log.debug("限定列依赖: {} -> {}", qualifier, canonical);
        }
        return true;
    }
}
