package org.pragmatica.metascript.macro;

import org.pragmatica.metascript.tree.Statement;
import org.pragmatica.metascript.tree.Statement.MacroDef;
import org.pragmatica.metascript.tree.TreeCopier;

import java.util.HashMap;
import java.util.Map;

/**
 * Copies a macro body, replacing every declaration of and reference to a locally bound
 * name with its fresh counterpart.
 *
 * <p>Inside a nested macro definition the nested macro's own parameters shadow the outer
 * bindings and are left alone.
 */
final class BindingRenamer extends TreeCopier {
    private final Map<String, String> renames;

    BindingRenamer(Map<String, String> renames) {
        this.renames = renames;
    }

    @Override
    protected String identifier(String name) {
        return renames.getOrDefault(name, name);
    }

    @Override
    public Statement visitMacroDef(MacroDef macroDef) {
        var visible = new HashMap<>(renames);
        macroDef.parameters().forEach(visible::remove);
        return new MacroDef(macroDef.name(), macroDef.parameters(), new BindingRenamer(visible).copyAll(macroDef.body()));
    }
}
