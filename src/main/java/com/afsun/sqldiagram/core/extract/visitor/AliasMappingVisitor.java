package com.afsun.sqldiagram.core.extract.visitor;

import com.afsun.sqldiagram.core.extract.StageScope;
import com.afsun.sqldiagram.core.util.IdentifierCanonicalizer;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.visitor.SQLASTVisitorAdapter;

/**
 * 收集阶段子树中所有表引用的别名：别名 -> 表规范名
 *
 * @author afsun
 */
public class AliasMappingVisitor extends SQLASTVisitorAdapter {

    private final StageScope scope;

    public AliasMappingVisitor(StageScope scope) {
        this.scope = scope;
    }

    @Override
    public boolean visit(SQLExprTableSource x) {
        String canonical = IdentifierCanonicalizer.extractIdentifier(x);
        if (canonical != null && x.getAlias() != null) {
            scope.addAlias(x.getAlias(), canonical);
        }
        return false;
    }
}
