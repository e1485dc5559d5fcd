package com.yang.generator.codegen.yang.service;

import com.yang.generator.YangFixtures;
import com.yang.generator.codegen.exception.SchemaResolutionException;
import com.yang.generator.codegen.model.core.context.ToolDiagnostics;
import com.yang.generator.model.NodeKind;
import com.yang.generator.model.SchemaNode;
import com.yang.generator.model.YangModule;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SchemaTreeBuilderService: grouping expansion, choices and augments.
 */
class SchemaTreeBuilderServiceTest {

    private static final String GROUPINGS = """
            module shared-groupings {
              prefix sg;

              grouping timers {
                leaf hold-time { type uint16; }
                leaf keepalive { type uint16; }
              }
            }
            """;

    @Test
    void testUsesFromImportedModuleKeepsOrigin() {
        String main = """
                module main-mod {
                  prefix mm;
                  import shared-groupings { prefix s; }

                  container peer {
                    uses s:timers;
                    leaf name { type string; }
                  }
                }
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        List<YangModule> modules = YangFixtures.build(diagnostics, main, GROUPINGS);

        YangModule mainModule = modules.get(0);
        SchemaNode peer = mainModule.findChild("peer").orElseThrow();

        assertThat(peer.getChildren()).extracting(SchemaNode::getName)
                .containsExactly("hold-time", "keepalive", "name");
        SchemaNode holdTime = peer.getChildren().get(0);
        assertThat(holdTime.getModule().getName()).isEqualTo("main-mod");
        assertThat(holdTime.getOriginModule().getName()).isEqualTo("shared-groupings");
        assertThat(holdTime.getType().getSourceModule().getName()).isEqualTo("shared-groupings");
        assertThat(peer.getChildren().get(2).getOriginModule()).isSameAs(mainModule);
    }

    @Test
    void testNestedGroupingFoundLexically() {
        String yang = """
                module lex {
                  prefix lx;
                  container outer {
                    grouping inner-fields {
                      leaf a { type string; }
                    }
                    container holder {
                      uses inner-fields;
                    }
                  }
                }
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        YangModule module = YangFixtures.build(diagnostics, yang).get(0);

        SchemaNode holder = module.findChild("outer").orElseThrow().getChildren().get(0);
        assertThat(holder.getName()).isEqualTo("holder");
        assertThat(holder.getChildren()).extracting(SchemaNode::getName).containsExactly("a");
    }

    @Test
    void testShorthandCaseIsWrapped() {
        String yang = """
                module ch {
                  prefix ch;
                  container top {
                    choice mode {
                      leaf simple { type string; }
                      case detailed {
                        leaf first { type string; }
                        leaf second { type string; }
                      }
                    }
                  }
                }
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        YangModule module = YangFixtures.build(diagnostics, yang).get(0);

        SchemaNode choice = module.findChild("top").orElseThrow().getChildren().get(0);
        assertThat(choice.getKind()).isEqualTo(NodeKind.CHOICE);
        assertThat(choice.getChildren()).extracting(SchemaNode::getKind).containsOnly(NodeKind.CASE);
        assertThat(choice.getChildren()).extracting(SchemaNode::getName).containsExactly("simple", "detailed");
        assertThat(choice.getChildren().get(0).getChildren().get(0).getName()).isEqualTo("simple");
    }

    @Test
    void testTopLevelAugmentFromOtherModule() {
        String base = """
                module base {
                  prefix b;
                  container system {
                    leaf hostname { type string; }
                  }
                }
                """;
        String ext = """
                module ext {
                  prefix e;
                  import base { prefix b; }
                  augment "/b:system" {
                    leaf location { type string; }
                  }
                }
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        List<YangModule> modules = YangFixtures.build(diagnostics, ext, base);

        SchemaNode system = modules.get(1).findChild("system").orElseThrow();
        assertThat(system.getChildren()).extracting(SchemaNode::getName).containsExactly("hostname", "location");

        SchemaNode location = system.getChildren().get(1);
        assertThat(location.getParent()).isSameAs(system);
        assertThat(location.getModule().getName()).isEqualTo("ext");
        assertThat(diagnostics.getWarnings()).isEmpty();
    }

    @Test
    void testAugmentInsideUses() {
        String yang = """
                module aug {
                  prefix ag;
                  grouping base-config {
                    container config {
                      leaf enabled { type boolean; }
                    }
                  }
                  container feature {
                    uses base-config {
                      augment "config" {
                        leaf extra { type string; }
                      }
                    }
                  }
                }
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        YangModule module = YangFixtures.build(diagnostics, yang).get(0);

        SchemaNode config = module.findChild("feature").orElseThrow().getChildren().get(0);
        assertThat(config.getChildren()).extracting(SchemaNode::getName).containsExactly("enabled", "extra");
    }

    @Test
    void testUnresolvedAugmentIsWarning() {
        String yang = """
                module lonely {
                  prefix lo;
                  augment "/lo:nowhere" {
                    leaf x { type string; }
                  }
                }
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        YangFixtures.build(diagnostics, yang);

        assertThat(diagnostics.getWarnings()).anyMatch(w -> w.contains("/lo:nowhere") && w.contains("was not found"));
    }

    @Test
    void testTypedefsAndIdentitiesAreCollected() {
        String yang = """
                module defs {
                  prefix d;
                  typedef top-level { type uint32; }
                  identity base-id;
                  identity child-id { base base-id; }
                  container c {
                    typedef nested { type string; }
                    leaf v { type nested; }
                  }
                }
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        YangModule module = YangFixtures.build(diagnostics, yang).get(0);

        assertThat(module.getTypedefs()).extracting(SchemaNode::getName).containsExactly("top-level", "nested");
        assertThat(module.getIdentities()).extracting(SchemaNode::getName).containsExactly("base-id", "child-id");
        assertThat(module.getIdentities().get(1).getBases()).containsExactly("base-id");
        assertThat(module.findChild("c").orElseThrow().getChildren()).extracting(SchemaNode::getName).containsExactly("v");
    }

    @Test
    void testMissingGroupingIsFatal() {
        String yang = """
                module broken {
                  prefix br;
                  container c { uses does-not-exist; }
                }
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        assertThatThrownBy(() -> YangFixtures.build(diagnostics, yang))
                .isInstanceOf(SchemaResolutionException.class)
                .hasMessageContaining("does-not-exist");
    }

    @Test
    void testModuleWithoutPrefixIsFatal() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        assertThatThrownBy(() -> YangFixtures.build(diagnostics, "module np { }"))
                .isInstanceOf(SchemaResolutionException.class)
                .hasMessageContaining("has no prefix");
    }
}
