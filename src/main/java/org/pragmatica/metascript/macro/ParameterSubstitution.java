package org.pragmatica.metascript.macro;

import org.pragmatica.metascript.tree.Expression;
import org.pragmatica.metascript.tree.Statement;
import org.pragmatica.metascript.tree.Statement.MacroDef;
import org.pragmatica.metascript.tree.TreeCopier;

import java.util.HashMap;
import java.util.Map;

/**
 * Copies a macro body, replacing each reference to a formal parameter with a fresh copy of
 * the argument expression. A parameter used twice yields two independent copies.
 *
 * <p>A nested macro definition that redeclares a parameter keeps its own meaning for it.
 */
final class ParameterSubstitution extends TreeCopier {
    private final Map<String, Expression> arguments;

    ParameterSubstitution(Map<String, Expression> arguments) {
        this.arguments = arguments;
    }

    @Override
    public Expression visitName(Expression.Name name) {
        var argument = arguments.get(name.identifier());
        return argument == null
               ? super.visitName(name)
               : deepCopy(argument);
    }

    @Override
    public Statement visitMacroDef(MacroDef macroDef) {
        var visible = new HashMap<>(arguments);
        macroDef.parameters().forEach(visible::remove);
        return new MacroDef(macroDef.name(),
                            macroDef.parameters(),
                            new ParameterSubstitution(visible).copyAll(macroDef.body()));
    }
}
