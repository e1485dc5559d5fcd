package com.yang.generator.codegen.resolver;

import com.yang.generator.YangFixtures;
import com.yang.generator.codegen.exception.SchemaResolutionException;
import com.yang.generator.codegen.model.core.context.GenerationContext;
import com.yang.generator.codegen.model.core.context.ToolDiagnostics;
import com.yang.generator.codegen.registry.TypedefDefinition;
import com.yang.generator.model.SchemaNode;
import com.yang.generator.model.YangModule;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TypeResolver.
 */
class TypeResolverTest {

    private static final String MODULE = """
            module res {
              prefix rs;
              import ietf-inet-types { prefix inet; }

              identity afi-safi-type;
              identity ipv4-unicast { base afi-safi-type; }
              identity lonely;

              typedef peer-kind {
                type enumeration {
                  enum internal;
                  enum external;
                }
              }
              typedef my-count { type uint64; }
              typedef relative-ref {
                type leafref { path "../name"; }
              }

              container top {
                container config {
                  leaf id { type uint32; }
                  leaf name { type string; }
                  leaf as { type inet:as-number; }
                  leaf port { type inet:port-number; }
                  leaf domain { type inet:domain-name; }
                  leaf count { type my-count; }
                  leaf kind { type peer-kind; }
                  leaf afi { type identityref { base afi-safi-type; } }
                  leaf lonely-kind { type identityref { base lonely; } }
                  leaf version { type inet:ip-version; }
                  leaf flag { type boolean; }
                  leaf mode {
                    type enumeration {
                      enum a;
                      enum b;
                    }
                  }
                  leaf mask { type bits { bit x; } }
                }
                container state {
                  leaf id-ref { type leafref { path "../../config/id"; } }
                  leaf id-ref-ref { type leafref { path "../id-ref"; } }
                  leaf name { type leafref { path "../config/name"; } }
                }
              }
            }
            """;

    private ToolDiagnostics diagnostics;
    private GenerationContext ctx;
    private TypeResolver resolver;
    private YangModule module;

    @BeforeEach
    void setUp() {
        diagnostics = new ToolDiagnostics();
        ctx = YangFixtures.prepare(diagnostics, MODULE, YangFixtures.INET_TYPES);
        resolver = new TypeResolver(ctx);
        module = ctx.getDependencies().getModulesByName().get("res");
    }

    @Test
    void testBuiltinType() {
        FieldType type = resolver.resolveField(leaf("config", "id"));

        assertThat(type.getRustType()).isEqualTo("u32");
        assertThat(type.getTranslatedFrom()).isNull();
    }

    @Test
    void testTranslatedTypesKeepOriginalName() {
        FieldType as = resolver.resolveField(leaf("config", "as"));
        FieldType port = resolver.resolveField(leaf("config", "port"));
        FieldType flag = resolver.resolveField(leaf("config", "flag"));

        assertThat(as.getRustType()).isEqualTo("u32");
        assertThat(as.getTranslatedFrom()).isEqualTo("inet:as-number");
        assertThat(port.getRustType()).isEqualTo("u16");
        assertThat(flag.getRustType()).isEqualTo("bool");
        assertThat(flag.getTranslatedFrom()).isEqualTo("boolean");
    }

    @Test
    void testLeafrefChainResolvesToTarget() {
        assertThat(resolver.resolveField(leaf("state", "id-ref")).getRustType()).isEqualTo("u32");
        assertThat(resolver.resolveField(leaf("state", "id-ref-ref")).getRustType()).isEqualTo("u32");
    }

    @Test
    void testRedundantConfigLeafrefIsDropped() {
        FieldType type = resolver.resolveField(leaf("state", "name"));

        assertThat(type.isDropped()).isTrue();
    }

    @Test
    void testIdentityrefUsesBaseName() {
        assertThat(resolver.resolveField(leaf("config", "afi")).getRustType()).isEqualTo("AfiSafiType");
    }

    @Test
    void testEnumerationsAreNamedAfterOwner() {
        assertThat(resolver.resolveField(leaf("config", "mode")).getRustType()).isEqualTo("Mode");
        assertThat(resolver.resolveField(leaf("config", "kind")).getRustType()).isEqualTo("PeerKind");
    }

    @Test
    void testEmittedTypedefIsReferencedByName() {
        FieldType type = resolver.resolveField(leaf("config", "count"));

        assertThat(type.getRustType()).isEqualTo("MyCount");
        assertThat(type.getTypedef()).isNotNull();
        assertThat(type.getTypedef().getName()).isEqualTo("my-count");
    }

    @Test
    void testTypedefOfExcludedModuleIsInlined() {
        FieldType type = resolver.resolveField(leaf("config", "domain"));

        assertThat(type.getRustType()).isEqualTo("String");
        assertThat(type.getTypedef()).isNull();
    }

    @Test
    void testEnumerationTypedefOfExcludedModuleIsEmittedOnDemand() {
        TypedefDefinition ipVersion = ctx.getTypedefRegistry().find("inet", "ip-version").orElseThrow();

        FieldType type = resolver.resolveField(leaf("config", "version"));

        assertThat(type.getRustType()).isEqualTo("IpVersion");
        assertThat(type.getTypedef()).isSameAs(ipVersion);
        assertThat(resolver.isEmitted(ipVersion)).isFalse();
        assertThat(resolver.isEmittedOnDemand(ipVersion)).isTrue();
    }

    @Test
    void testIdentityrefWithoutDerivedIdentitiesFallsBackToString() {
        FieldType type = resolver.resolveField(leaf("config", "lonely-kind"));

        assertThat(type.getRustType()).isEqualTo("String");
        assertThat(diagnostics.getWarnings()).anyMatch(w -> w.contains("rs:lonely"));
    }

    @Test
    void testUnmappedBuiltinFallsBackToStringWithWarning() {
        FieldType type = resolver.resolveField(leaf("config", "mask"));

        assertThat(type.getRustType()).isEqualTo("String");
        assertThat(diagnostics.getWarnings()).anyMatch(w -> w.contains("bits"));
    }

    @Test
    void testRelativeLeafrefTypedefFallsBackToString() {
        TypedefDefinition typedef = ctx.getTypedefRegistry().find("rs", "relative-ref").orElseThrow();

        FieldType type = resolver.resolveTypedefTarget(typedef);

        assertThat(type.getRustType()).isEqualTo("String");
        assertThat(diagnostics.getWarnings()).anyMatch(w -> w.contains("relative-ref") && w.contains("relative leafref"));
    }

    @Test
    void testIsEmittedRules() {
        TypedefDefinition count = ctx.getTypedefRegistry().find("rs", "my-count").orElseThrow();
        TypedefDefinition port = ctx.getTypedefRegistry().find("inet", "port-number").orElseThrow();

        assertThat(resolver.isEmitted(count)).isTrue();
        assertThat(resolver.isEmitted(port)).isFalse();
        assertThat(resolver.isEmittedOnDemand(count)).isFalse();
        assertThat(resolver.isEmittedOnDemand(port)).isFalse();
    }

    @Test
    void testMissingTypedefIsFatal() {
        String broken = """
                module broken {
                  prefix br;
                  container c {
                    leaf v { type no-such-type; }
                  }
                }
                """;
        ToolDiagnostics diag = new ToolDiagnostics();
        GenerationContext brokenCtx = YangFixtures.prepare(diag, broken);
        SchemaNode leaf = brokenCtx.getDependencies().getModulesByName().get("broken")
                .findChild("c").orElseThrow().getChildren().get(0);

        assertThatThrownBy(() -> new TypeResolver(brokenCtx).resolveField(leaf))
                .isInstanceOf(SchemaResolutionException.class)
                .hasMessageContaining("typedef no-such-type");
    }

    @Test
    void testMissingIdentityIsFatal() {
        String broken = """
                module broken {
                  prefix br;
                  container c {
                    leaf v { type identityref { base no-such-identity; } }
                  }
                }
                """;
        ToolDiagnostics diag = new ToolDiagnostics();
        GenerationContext brokenCtx = YangFixtures.prepare(diag, broken);
        SchemaNode leaf = brokenCtx.getDependencies().getModulesByName().get("broken")
                .findChild("c").orElseThrow().getChildren().get(0);

        assertThatThrownBy(() -> new TypeResolver(brokenCtx).resolveField(leaf))
                .isInstanceOf(SchemaResolutionException.class)
                .hasMessageContaining("identity no-such-identity");
    }

    @Test
    void testDanglingLeafrefIsFatal() {
        String broken = """
                module broken {
                  prefix br;
                  container c {
                    leaf v { type leafref { path "../missing"; } }
                  }
                }
                """;
        ToolDiagnostics diag = new ToolDiagnostics();
        GenerationContext brokenCtx = YangFixtures.prepare(diag, broken);
        SchemaNode leaf = brokenCtx.getDependencies().getModulesByName().get("broken")
                .findChild("c").orElseThrow().getChildren().get(0);

        assertThatThrownBy(() -> new TypeResolver(brokenCtx).resolveField(leaf))
                .isInstanceOf(SchemaResolutionException.class)
                .hasMessageContaining("no data node named 'missing'");
    }

    private SchemaNode leaf(String container, String name) {
        SchemaNode top = module.findChild("top").orElseThrow();
        SchemaNode parent = top.getChildren().stream()
                .filter(c -> c.getName().equals(container))
                .findFirst().orElseThrow();
        return parent.getChildren().stream()
                .filter(c -> c.getName().equals(name))
                .findFirst().orElseThrow();
    }
}
