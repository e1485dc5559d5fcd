package com.yang.generator.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A linked YANG module: identity, import table and expanded schema tree.
 */
@Getter
@ToString(of = {"name", "prefix"})
public class YangModule {
    private final String name;
    private final String prefix;
    private final String namespace;
    private final String revision;
    private final String description;

    /** Import alias → imported module name, in import statement order. */
    private final Map<String, String> imports;

    private final List<SchemaNode> children = new ArrayList<>();
    private final List<SchemaNode> typedefs = new ArrayList<>();
    private final List<SchemaNode> identities = new ArrayList<>();

    /** Top-level groupings by name. */
    private final Map<String, Statement> groupings = new LinkedHashMap<>();

    private final Statement statement;

    @Builder
    public YangModule(String name, String prefix, String namespace, String revision,
                      String description, Map<String, String> imports, Statement statement) {
        this.name = name;
        this.prefix = prefix;
        this.namespace = namespace;
        this.revision = revision;
        this.description = description;
        this.imports = imports != null ? new LinkedHashMap<>(imports) : new LinkedHashMap<>();
        this.statement = statement;
    }

    public void addChild(SchemaNode child) {
        children.add(child);
        child.setParent(null);
    }

    /**
     * Module name a prefix stands for inside this module: its own prefix or an import alias.
     */
    public Optional<String> moduleNameFor(String alias) {
        if (alias == null || alias.equals(prefix)) {
            return Optional.of(name);
        }
        return Optional.ofNullable(imports.get(alias));
    }

    public Optional<SchemaNode> findChild(String childName) {
        return children.stream().filter(c -> c.getName().equals(childName)).findFirst();
    }
}
