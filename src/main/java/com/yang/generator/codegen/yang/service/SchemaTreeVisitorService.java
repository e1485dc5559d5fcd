package com.yang.generator.codegen.yang.service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yang.generator.codegen.model.NodeFacts;
import com.yang.generator.codegen.model.core.context.GenerationContext;
import com.yang.generator.codegen.registry.StructCandidate;
import com.yang.generator.codegen.registry.StructKey;
import com.yang.generator.codegen.registry.TypedefDefinition;
import com.yang.generator.codegen.yang.util.YangNamingUtil;
import com.yang.generator.model.NodeKind;
import com.yang.generator.model.SchemaNode;
import com.yang.generator.model.SchemaNodeVisitor;
import com.yang.generator.model.TypeKind;
import com.yang.generator.model.YangModule;

/**
 * Walks a module's data tree: assigns unique names, flattens choices (collapsing presence-only
 * choices into enums), registers embedded enumerations and struct candidates.
 */
public class SchemaTreeVisitorService {
    private static final Logger log = LoggerFactory.getLogger(SchemaTreeVisitorService.class);

    /** Leaf types that make a case a pure presence marker. */
    private static final Set<String> PRESENCE_TYPES = Set.of("empty");

    private static final String MP_GRACEFUL_RESTART_PREFIX = "bgp-mp";

    public void visitModule(YangModule module, GenerationContext ctx) {
        log.debug("Visiting data tree of module {}", module.getName());
        RegistrationVisitor visitor = new RegistrationVisitor(module, ctx);
        for (SchemaNode child : module.getChildren()) {
            visitor.visitChild(child);
        }
    }

    /**
     * Unique name of a node given the unique name of its nearest visited ancestor (null at
     * the top level).
     */
    public static String uniqueNameOf(SchemaNode node, String enclosingUniqueName, String originPrefix) {
        String name = node.getName();
        if (enclosingUniqueName != null && name.equals("config")) {
            return enclosingUniqueName + "-config";
        }
        if (enclosingUniqueName != null && name.equals("state")) {
            return enclosingUniqueName + "-state";
        }
        if (name.equals("graceful-restart") && MP_GRACEFUL_RESTART_PREFIX.equals(originPrefix)) {
            return "mp-graceful-restart";
        }
        return name;
    }

    /**
     * {@code /prefix:name/...} from the module root, with choices and cases included.
     * Each step uses the prefix of the module the node is instantiated in.
     */
    public static String structuralPath(SchemaNode node) {
        Deque<String> steps = new ArrayDeque<>();
        for (SchemaNode n = node; n != null; n = n.getParent()) {
            steps.addFirst("/" + n.getModule().getPrefix() + ":" + n.getName());
        }
        return String.join("", steps);
    }

    /**
     * Children of every case of a choice, in case order.
     */
    public static List<SchemaNode> flattenChoice(SchemaNode choice) {
        List<SchemaNode> result = new ArrayList<>();
        for (SchemaNode child : choice.getChildren()) {
            if (child.is(NodeKind.CASE)) {
                result.addAll(child.getChildren());
            } else {
                result.add(child);
            }
        }
        return result;
    }

    public static boolean isPresenceOnly(List<SchemaNode> children) {
        return !children.isEmpty() && children.stream().allMatch(c -> c.is(NodeKind.LEAF)
                && c.getType() != null && PRESENCE_TYPES.contains(c.getType().getName()));
    }

    private static class RegistrationVisitor implements SchemaNodeVisitor<Void> {
        private final YangModule module;
        private final GenerationContext ctx;
        private final Deque<NodeFacts> enclosing = new ArrayDeque<>();

        RegistrationVisitor(YangModule module, GenerationContext ctx) {
            this.module = module;
            this.ctx = ctx;
        }

        void visitChild(SchemaNode node) {
            String originPrefix = node.getOriginModule().getPrefix();
            String parentUnique = enclosing.isEmpty() ? null : enclosing.peek().getUniqueName();

            NodeFacts facts = NodeFacts.builder()
                    .uniqueName(uniqueNameOf(node, parentUnique, originPrefix))
                    .originPrefix(originPrefix)
                    .path(structuralPath(node))
                    .build();
            ctx.getFacts().put(node, facts);
            node.accept(this);
        }

        @Override
        public Void visitDefault(SchemaNode node) {
            return null;
        }

        @Override
        public Void visitLeaf(SchemaNode leaf) {
            registerEmbeddedEnum(leaf);
            return null;
        }

        @Override
        public Void visitLeafList(SchemaNode leafList) {
            registerEmbeddedEnum(leafList);
            return null;
        }

        @Override
        public Void visitContainer(SchemaNode container) {
            registerStruct(container, container.getChildren());
            return null;
        }

        @Override
        public Void visitList(SchemaNode list) {
            registerStruct(list, list.getChildren());
            return null;
        }

        @Override
        public Void visitChoice(SchemaNode choice) {
            List<SchemaNode> picks = flattenChoice(choice);
            NodeFacts facts = ctx.factsOf(choice);

            if (isPresenceOnly(picks)) {
                facts.setEnumChoice(true);
                facts.setEffectiveChildren(picks);
                facts.setTypeName(YangNamingUtil.toTypeName(choice.getName()));
                register(TypedefDefinition.builder()
                        .kind(TypedefDefinition.Kind.CHOICE_ENUM)
                        .name(choice.getName())
                        .typeName(facts.getTypeName())
                        .prefix(module.getPrefix())
                        .node(choice)
                        .path(facts.getPath())
                        .build());
                return null;
            }

            registerStruct(choice, picks);
            return null;
        }

        private void registerEmbeddedEnum(SchemaNode leaf) {
            if (leaf.getType() == null || !leaf.getType().isKind(TypeKind.ENUMERATION)) {
                return;
            }
            NodeFacts facts = ctx.factsOf(leaf);
            register(TypedefDefinition.builder()
                    .kind(TypedefDefinition.Kind.EMBEDDED_ENUM)
                    .name(leaf.getName())
                    .typeName(YangNamingUtil.toTypeName(leaf.getName()))
                    .prefix(module.getPrefix())
                    .node(leaf)
                    .path(facts.getPath())
                    .build());
        }

        private void register(TypedefDefinition def) {
            if (!ctx.getTypedefRegistry().register(def)) {
                log.debug("Enumeration {}:{} already registered, keeping the first", def.getPrefix(), def.getName());
            }
        }

        private void registerStruct(SchemaNode node, List<SchemaNode> effectiveChildren) {
            NodeFacts facts = ctx.factsOf(node);
            facts.setEffectiveChildren(effectiveChildren);
            facts.setTypeName(YangNamingUtil.toTypeName(facts.getUniqueName()));

            StructKey key = new StructKey(facts.getOriginPrefix(), facts.getUniqueName());
            ctx.getStructRegistry().registerOrMerge(new StructCandidate(key, node, facts));

            enclosing.push(facts);
            try {
                for (SchemaNode child : effectiveChildren) {
                    visitChild(child);
                }
            } finally {
                enclosing.pop();
            }
        }
    }
}
