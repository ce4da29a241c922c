package statemigrator.transform;

import java.util.List;

/**
 * Result of {@link ConfigTransformer#rewriteModuleSources}.
 *
 * @param text the rewritten text
 * @param changedCount number of module sources rewritten
 * @param modules names of the rewritten module blocks, in file order
 */
public record ModuleRewrite(String text, int changedCount, List<String> modules) {

    public ModuleRewrite {
        modules = List.copyOf(modules);
    }
}
