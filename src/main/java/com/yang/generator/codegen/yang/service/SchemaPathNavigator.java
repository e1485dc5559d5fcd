package com.yang.generator.codegen.yang.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yang.generator.codegen.exception.SchemaResolutionException;
import com.yang.generator.model.NodeKind;
import com.yang.generator.model.SchemaNode;
import com.yang.generator.model.TypeStatement;
import com.yang.generator.model.YangModule;

/**
 * Path lookups over the expanded schema tree.
 *
 * Leafref paths are data paths: choices and cases are transparent and predicates are
 * ignored. Augment targets are schema node ids: choices and cases are named steps.
 */
public class SchemaPathNavigator {
    private static final Logger log = LoggerFactory.getLogger(SchemaPathNavigator.class);

    private static final Pattern PREDICATE = Pattern.compile("\\[[^\\]]*\\]");

    private final Map<String, YangModule> modulesByName;

    public SchemaPathNavigator(Map<String, YangModule> modulesByName) {
        this.modulesByName = modulesByName;
    }

    /**
     * Resolve the target leaf of a leafref type used by {@code context}.
     *
     * @param context the leaf or leaf-list carrying the type; null when the leafref sits in a
     *                typedef, in which case only absolute paths can be resolved
     */
    public SchemaNode resolveLeafref(SchemaNode context, TypeStatement type) {
        String rawPath = type.getPath();
        if (rawPath == null || rawPath.isBlank()) {
            throw new SchemaResolutionException("leafref without path in module "
                    + type.getSourceModule().getName());
        }

        String path = PREDICATE.matcher(rawPath).replaceAll("").trim();
        List<String> steps = splitSteps(path);
        YangModule source = type.getSourceModule();

        SchemaNode current;
        List<SchemaNode> candidates;
        int index = 0;

        if (path.startsWith("/")) {
            current = null;
            candidates = topLevelDataNodes(moduleForPrefix(source, TypeStatement.prefixOf(steps.get(0)), rawPath));
        } else {
            if (context == null) {
                throw new SchemaResolutionException("relative leafref path '" + rawPath
                        + "' cannot be resolved outside a data node (module " + source.getName() + ")");
            }
            current = context;
            candidates = null;
        }

        YangModule rootModule = context != null ? context.getModule() : source;

        for (; index < steps.size(); index++) {
            String step = steps.get(index);
            if (step.equals("..")) {
                if (current == null) {
                    throw new SchemaResolutionException("leafref path '" + rawPath + "' climbs above the module root");
                }
                current = dataParent(current);
                candidates = null;
                continue;
            }
            if (step.equals(".")) {
                continue;
            }

            List<SchemaNode> pool = candidates != null ? candidates
                    : current == null ? topLevelDataNodes(rootModule) : dataChildren(current);
            String local = TypeStatement.localNameOf(step);
            current = pool.stream()
                    .filter(n -> n.getName().equals(local))
                    .findFirst()
                    .orElseThrow(() -> new SchemaResolutionException("leafref path '" + rawPath
                            + "' in module " + source.getName() + ": no data node named '" + local + "'"));
            candidates = null;
        }

        if (current == null || !(current.is(NodeKind.LEAF) || current.is(NodeKind.LEAF_LIST))) {
            throw new SchemaResolutionException("leafref path '" + rawPath + "' in module "
                    + source.getName() + " does not point to a leaf");
        }

        log.debug("leafref {} -> {}", rawPath, current.getName());
        return current;
    }

    /**
     * Resolve an absolute schema node id such as {@code /a:top/a:choice/a:case/a:leaf}.
     */
    public Optional<SchemaNode> findSchemaNode(YangModule source, String schemaNodeId) {
        List<String> steps = splitSteps(schemaNodeId.trim());
        if (steps.isEmpty()) {
            return Optional.empty();
        }
        YangModule target = modulesByName.get(
                source.moduleNameFor(TypeStatement.prefixOf(steps.get(0))).orElse(""));
        if (target == null) {
            return Optional.empty();
        }
        return findDescendant(target.getChildren(), steps);
    }

    /**
     * Resolve a descendant schema node id relative to a set of sibling nodes.
     */
    public Optional<SchemaNode> findDescendant(List<SchemaNode> roots, List<String> steps) {
        List<SchemaNode> pool = roots;
        SchemaNode current = null;
        for (String step : steps) {
            String local = TypeStatement.localNameOf(step);
            current = pool.stream().filter(n -> n.getName().equals(local)).findFirst().orElse(null);
            if (current == null) {
                return Optional.empty();
            }
            pool = current.getChildren();
        }
        return Optional.ofNullable(current);
    }

    public static List<String> splitSteps(String path) {
        List<String> steps = new ArrayList<>();
        for (String part : path.split("/")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                steps.add(trimmed);
            }
        }
        return steps;
    }

    /**
     * Nearest ancestor that is a data node; choices and cases are skipped. Null at the top.
     */
    public static SchemaNode dataParent(SchemaNode node) {
        SchemaNode parent = node.getParent();
        while (parent != null && (parent.is(NodeKind.CHOICE) || parent.is(NodeKind.CASE))) {
            parent = parent.getParent();
        }
        return parent;
    }

    /**
     * Children as seen in the data tree: choice and case levels are flattened away.
     */
    public static List<SchemaNode> dataChildren(SchemaNode node) {
        List<SchemaNode> result = new ArrayList<>();
        collectDataNodes(node.getChildren(), result);
        return result;
    }

    private static List<SchemaNode> topLevelDataNodes(YangModule module) {
        List<SchemaNode> result = new ArrayList<>();
        collectDataNodes(module.getChildren(), result);
        return result;
    }

    private static void collectDataNodes(List<SchemaNode> nodes, List<SchemaNode> into) {
        for (SchemaNode n : nodes) {
            if (n.is(NodeKind.CHOICE) || n.is(NodeKind.CASE)) {
                collectDataNodes(n.getChildren(), into);
            } else {
                into.add(n);
            }
        }
    }

    private YangModule moduleForPrefix(YangModule source, String prefix, String rawPath) {
        String moduleName = source.moduleNameFor(prefix)
                .orElseThrow(() -> new SchemaResolutionException("leafref path '" + rawPath
                        + "' uses unknown prefix '" + prefix + "' in module " + source.getName()));
        YangModule module = modulesByName.get(moduleName);
        if (module == null) {
            throw new SchemaResolutionException("leafref path '" + rawPath + "' refers to module "
                    + moduleName + " which was not loaded");
        }
        return module;
    }
}
