package com.yang.generator.codegen.yang.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yang.generator.codegen.exception.SchemaResolutionException;
import com.yang.generator.codegen.model.core.context.ToolDiagnostics;
import com.yang.generator.model.EnumValue;
import com.yang.generator.model.NodeKind;
import com.yang.generator.model.SchemaNode;
import com.yang.generator.model.Statement;
import com.yang.generator.model.TypeStatement;
import com.yang.generator.model.YangModule;

import lombok.Value;

/**
 * Turns parsed module statements into linked {@link YangModule}s.
 *
 * <ul>
 *   <li>{@code uses} is expanded in place (lexical grouping lookup, or through an import prefix)</li>
 *   <li>data nodes written directly under a {@code choice} get an implicit {@code case}</li>
 *   <li>top-level {@code augment}s are applied once every tree is built</li>
 * </ul>
 *
 * Statements without a counterpart in the generated types (rpc, notification, anyxml,
 * if-feature, must, when, ...) are ignored.
 */
public class SchemaTreeBuilderService {
    private static final Logger log = LoggerFactory.getLogger(SchemaTreeBuilderService.class);

    private static final int MAX_GROUPING_DEPTH = 64;
    private static final int AUGMENT_PASSES = 2;

    private final ToolDiagnostics diagnostics;
    private final Map<String, YangModule> modulesByName = new LinkedHashMap<>();
    private final SchemaPathNavigator navigator = new SchemaPathNavigator(modulesByName);

    public SchemaTreeBuilderService(ToolDiagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Build modules from their statements. Returned modules keep the input order.
     */
    public List<YangModule> build(List<Statement> moduleStatements) {
        List<YangModule> modules = new ArrayList<>();
        for (Statement stmt : moduleStatements) {
            YangModule module = createModule(stmt);
            if (modulesByName.putIfAbsent(module.getName(), module) != null) {
                diagnostics.warn("Module " + module.getName() + " supplied twice, keeping the first");
                continue;
            }
            modules.add(module);
        }

        for (YangModule module : modules) {
            buildTypedefs(module);
            buildIdentities(module);
        }

        for (YangModule module : modules) {
            log.debug("Building data tree of module {}", module.getName());
            for (SchemaNode node : buildNodes(module.getStatement(), module, module, 0)) {
                module.addChild(node);
            }
        }

        applyAugments(modules);
        return modules;
    }

    public Map<String, YangModule> getModulesByName() {
        return modulesByName;
    }

    private YangModule createModule(Statement stmt) {
        String prefix = stmt.argumentOf("prefix");
        if (prefix == null || prefix.isBlank()) {
            throw new SchemaResolutionException("module " + stmt.getArgument() + " (" + stmt.location()
                    + ") has no prefix");
        }

        Map<String, String> imports = new LinkedHashMap<>();
        for (Statement imp : stmt.findAll("import")) {
            String alias = imp.argumentOf("prefix");
            if (alias == null) {
                diagnostics.warn("import of " + imp.getArgument() + " without prefix at " + imp.location());
                continue;
            }
            imports.put(alias, imp.getArgument());
        }

        YangModule module = YangModule.builder()
                .name(stmt.getArgument())
                .prefix(prefix)
                .namespace(stmt.argumentOf("namespace"))
                .revision(stmt.argumentOf("revision"))
                .description(stmt.argumentOf("description"))
                .imports(imports)
                .statement(stmt)
                .build();

        for (Statement grouping : stmt.findAll("grouping")) {
            module.getGroupings().put(grouping.getArgument(), grouping);
        }
        return module;
    }

    // ----------------------------------------------------------------------
    // Typedefs / identities
    // ----------------------------------------------------------------------

    private void buildTypedefs(YangModule module) {
        Statement root = module.getStatement();
        for (Statement td : root.findAll("typedef")) {
            module.getTypedefs().add(buildTypedef(td, module));
        }
        for (Statement child : root.getSubstatements()) {
            if (!"typedef".equals(child.getKeyword())) {
                collectNestedTypedefs(child, module);
            }
        }
    }

    private void collectNestedTypedefs(Statement stmt, YangModule module) {
        for (Statement child : stmt.getSubstatements()) {
            if ("typedef".equals(child.getKeyword())) {
                module.getTypedefs().add(buildTypedef(child, module));
            } else {
                collectNestedTypedefs(child, module);
            }
        }
    }

    private SchemaNode buildTypedef(Statement td, YangModule module) {
        Statement typeStmt = td.findFirst("type")
                .orElseThrow(() -> new SchemaResolutionException("typedef " + td.getArgument()
                        + " at " + td.location() + " has no type"));
        return SchemaNode.builder()
                .kind(NodeKind.TYPEDEF)
                .name(td.getArgument())
                .module(module)
                .type(buildType(typeStmt, module))
                .description(td.argumentOf("description"))
                .defaultValue(td.argumentOf("default"))
                .statement(td)
                .build();
    }

    private void buildIdentities(YangModule module) {
        for (Statement id : module.getStatement().findAll("identity")) {
            List<String> bases = new ArrayList<>();
            for (Statement base : id.findAll("base")) {
                bases.add(base.getArgument());
            }
            module.getIdentities().add(SchemaNode.builder()
                    .kind(NodeKind.IDENTITY)
                    .name(id.getArgument())
                    .module(module)
                    .description(id.argumentOf("description"))
                    .bases(bases)
                    .statement(id)
                    .build());
        }
    }

    /**
     * Build a type statement; prefixes in it belong to {@code sourceModule}.
     */
    TypeStatement buildType(Statement typeStmt, YangModule sourceModule) {
        TypeStatement.TypeStatementBuilder builder = TypeStatement.builder()
                .name(typeStmt.getArgument())
                .sourceModule(sourceModule)
                .path(typeStmt.argumentOf("path"))
                .base(typeStmt.argumentOf("base"))
                .description(typeStmt.argumentOf("description"));

        for (Statement e : typeStmt.findAll("enum")) {
            builder.enumValue(new EnumValue(e.getArgument(), e.argumentOf("description")));
        }
        for (Statement member : typeStmt.findAll("type")) {
            builder.unionMember(buildType(member, sourceModule));
        }
        return builder.build();
    }

    // ----------------------------------------------------------------------
    // Data trees
    // ----------------------------------------------------------------------

    /**
     * Build the data nodes declared under {@code parent}.
     *
     * @param module the module whose tree receives the nodes
     * @param origin the module whose text contains {@code parent}
     */
    private List<SchemaNode> buildNodes(Statement parent, YangModule module, YangModule origin, int depth) {
        List<SchemaNode> nodes = new ArrayList<>();
        for (Statement child : parent.getSubstatements()) {
            if ("uses".equals(child.getKeyword())) {
                nodes.addAll(expandUses(child, module, origin, depth));
                continue;
            }
            Optional<NodeKind> kind = NodeKind.fromKeyword(child.getKeyword());
            if (kind.isEmpty() || kind.get() == NodeKind.TYPEDEF || kind.get() == NodeKind.IDENTITY) {
                continue;
            }
            nodes.add(buildNode(child, kind.get(), module, origin, depth));
        }
        return nodes;
    }

    private SchemaNode buildNode(Statement stmt, NodeKind kind, YangModule module, YangModule origin, int depth) {
        SchemaNode node = SchemaNode.builder()
                .kind(kind)
                .name(stmt.getArgument())
                .module(module)
                .originModule(origin)
                .description(stmt.argumentOf("description"))
                .key(stmt.argumentOf("key"))
                .defaultValue(stmt.argumentOf("default"))
                .statement(stmt)
                .build();

        switch (kind) {
            case LEAF, LEAF_LIST -> {
                Statement typeStmt = stmt.findFirst("type")
                        .orElseThrow(() -> new SchemaResolutionException(kind.getKeyword() + " "
                                + stmt.getArgument() + " at " + stmt.location() + " has no type"));
                node.setType(buildType(typeStmt, origin));
            }
            case CHOICE -> attachToChoice(node, buildNodes(stmt, module, origin, depth));
            default -> buildNodes(stmt, module, origin, depth).forEach(node::addChild);
        }
        return node;
    }

    /**
     * Cases are added as they are; any other data node gets an implicit case of the same name.
     */
    private static void attachToChoice(SchemaNode choice, List<SchemaNode> children) {
        for (SchemaNode child : children) {
            if (child.is(NodeKind.CASE)) {
                choice.addChild(child);
                continue;
            }
            SchemaNode implicitCase = SchemaNode.builder()
                    .kind(NodeKind.CASE)
                    .name(child.getName())
                    .module(choice.getModule())
                    .originModule(choice.getOriginModule())
                    .build();
            implicitCase.addChild(child);
            choice.addChild(implicitCase);
        }
    }

    private static void attach(SchemaNode target, List<SchemaNode> children) {
        if (target.is(NodeKind.CHOICE)) {
            attachToChoice(target, children);
        } else {
            children.forEach(target::addChild);
        }
    }

    private List<SchemaNode> expandUses(Statement uses, YangModule module, YangModule origin, int depth) {
        if (depth >= MAX_GROUPING_DEPTH) {
            throw new SchemaResolutionException("grouping expansion deeper than " + MAX_GROUPING_DEPTH
                    + " levels at " + uses.location() + " (recursive grouping?)");
        }

        String groupingName = uses.getArgument();
        String prefix = TypeStatement.prefixOf(groupingName);
        String local = TypeStatement.localNameOf(groupingName);

        YangModule groupingModule = origin;
        Statement grouping = null;

        if (prefix != null && !prefix.equals(origin.getPrefix())) {
            String moduleName = origin.moduleNameFor(prefix).orElseThrow(() -> new SchemaResolutionException(
                    "uses " + groupingName + " at " + uses.location() + ": unknown prefix '" + prefix + "'"));
            groupingModule = modulesByName.get(moduleName);
            if (groupingModule == null) {
                throw new SchemaResolutionException("uses " + groupingName + " at " + uses.location()
                        + ": module " + moduleName + " was not loaded");
            }
            grouping = groupingModule.getGroupings().get(local);
        } else {
            grouping = findLexicalGrouping(uses, local, origin);
        }

        if (grouping == null) {
            throw new SchemaResolutionException("grouping " + groupingName + " used at " + uses.location()
                    + " was not found");
        }

        List<SchemaNode> expanded = buildNodes(grouping, module, groupingModule, depth + 1);

        for (Statement augment : uses.findAll("augment")) {
            List<String> steps = SchemaPathNavigator.splitSteps(augment.getArgument());
            Optional<SchemaNode> target = navigator.findDescendant(expanded, steps);
            if (target.isEmpty()) {
                diagnostics.warn("augment " + augment.getArgument() + " inside uses at "
                        + augment.location() + " does not match any expanded node");
                continue;
            }
            attach(target.get(), buildNodes(augment, module, origin, depth + 1));
        }
        return expanded;
    }

    private static Statement findLexicalGrouping(Statement uses, String name, YangModule origin) {
        Statement scope = uses.getParent();
        while (scope != null) {
            for (Statement g : scope.findAll("grouping")) {
                if (name.equals(g.getArgument())) {
                    return g;
                }
            }
            scope = scope.getParent();
        }
        return origin.getGroupings().get(name);
    }

    // ----------------------------------------------------------------------
    // Augments
    // ----------------------------------------------------------------------

    private void applyAugments(List<YangModule> modules) {
        List<PendingAugment> pending = new ArrayList<>();
        for (YangModule module : modules) {
            for (Statement augment : module.getStatement().findAll("augment")) {
                pending.add(new PendingAugment(module, augment));
            }
        }

        for (int pass = 0; pass < AUGMENT_PASSES && !pending.isEmpty(); pass++) {
            List<PendingAugment> unresolved = new ArrayList<>();
            for (PendingAugment p : pending) {
                Optional<SchemaNode> target = navigator.findSchemaNode(p.getModule(), p.getStatement().getArgument());
                if (target.isEmpty()) {
                    unresolved.add(p);
                    continue;
                }
                SchemaNode node = target.get();
                if (node.is(NodeKind.LEAF) || node.is(NodeKind.LEAF_LIST)) {
                    diagnostics.warn("augment " + p.getStatement().getArgument() + " at "
                            + p.getStatement().location() + " targets a " + node.getKind().getKeyword() + ", ignored");
                    continue;
                }
                log.debug("Applying augment {} from module {}", p.getStatement().getArgument(), p.getModule().getName());
                attach(node, buildNodes(p.getStatement(), p.getModule(), p.getModule(), 0));
            }
            pending = unresolved;
        }

        for (PendingAugment p : pending) {
            String msg = "augment target " + p.getStatement().getArgument() + " (" + p.getStatement().location()
                    + ") was not found";
            diagnostics.warn(msg);
            log.warn(msg);
        }
    }

    @Value
    private static class PendingAugment {
        YangModule module;
        Statement statement;
    }
}
