package com.yang.generator.codegen.yang.service;

import com.yang.generator.YangFixtures;
import com.yang.generator.codegen.model.NodeFacts;
import com.yang.generator.codegen.model.core.context.GenerationContext;
import com.yang.generator.codegen.model.core.context.ToolDiagnostics;
import com.yang.generator.codegen.registry.StructCandidate;
import com.yang.generator.codegen.registry.StructKey;
import com.yang.generator.codegen.registry.TypedefDefinition;
import com.yang.generator.model.SchemaNode;
import com.yang.generator.model.YangModule;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SchemaTreeVisitorService: unique names, struct registration and choice handling.
 */
class SchemaTreeVisitorServiceTest {

    private static final String NEIGHBOR = """
            module names {
              prefix nm;
              container neighbor {
                container config {
                  leaf address { type string; }
                }
                container state {
                  leaf uptime { type uint32; }
                }
                container graceful-restart {
                  leaf enabled { type boolean; }
                }
              }
            }
            """;

    @Test
    void testConfigAndStateGetEnclosingName() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        GenerationContext ctx = YangFixtures.prepare(diagnostics, NEIGHBOR);

        assertThat(ctx.getStructRegistry().candidates())
                .extracting(c -> c.getKey().getUniqueName())
                .containsExactly("neighbor", "neighbor-config", "neighbor-state", "graceful-restart");
        assertThat(ctx.getStructRegistry().candidates())
                .extracting(StructCandidate::getTypeName)
                .containsExactly("Neighbor", "NeighborConfig", "NeighborState", "GracefulRestart");
    }

    @Test
    void testStructuralPathUsesInstantiatingPrefix() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        GenerationContext ctx = YangFixtures.prepare(diagnostics, NEIGHBOR);

        StructCandidate config = ctx.getStructRegistry().find(new StructKey("nm", "neighbor-config")).orElseThrow();
        SchemaNode address = config.getFacts().getEffectiveChildren().get(0);

        assertThat(ctx.factsOf(address).getPath()).isEqualTo("/nm:neighbor/nm:config/nm:address");
        assertThat(ctx.factsOf(address).getUniqueName()).isEqualTo("address");
    }

    @Test
    void testGracefulRestartFromMultiprotocolModuleIsRenamed() {
        String mp = """
                module bgp-multiprotocol {
                  prefix bgp-mp;
                  grouping mp-all-afi-safi-common {
                    container graceful-restart {
                      leaf enabled { type boolean; }
                    }
                  }
                }
                """;
        String main = """
                module bgp-main {
                  prefix bgp;
                  import bgp-multiprotocol { prefix bgp-mp; }
                  container afi-safi {
                    uses bgp-mp:mp-all-afi-safi-common;
                  }
                }
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        GenerationContext ctx = YangFixtures.prepare(diagnostics, main, mp);

        assertThat(ctx.getStructRegistry().find(new StructKey("bgp-mp", "mp-graceful-restart"))).isPresent();
        assertThat(ctx.getStructRegistry().find(new StructKey("bgp-mp", "mp-graceful-restart")).orElseThrow()
                .getTypeName()).isEqualTo("MpGracefulRestart");
    }

    @Test
    void testRicherDuplicateReplacesAtFirstPosition() {
        String yang = """
                module merge {
                  prefix mg;
                  container first {
                    container timers {
                      leaf a { type uint8; }
                      leaf b { type uint8; }
                    }
                  }
                  container second {
                    container timers {
                      leaf a { type uint8; }
                      leaf b { type uint8; }
                      leaf c { type uint8; }
                      leaf d { type uint8; }
                      leaf e { type uint8; }
                    }
                  }
                }
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        GenerationContext ctx = YangFixtures.prepare(diagnostics, yang);

        assertThat(ctx.getStructRegistry().candidates())
                .extracting(c -> c.getKey().getUniqueName())
                .containsExactly("first", "timers", "second");
        StructCandidate timers = ctx.getStructRegistry().find(new StructKey("mg", "timers")).orElseThrow();
        assertThat(timers.childCount()).isEqualTo(5);
        assertThat(timers.getNode().getParent().getName()).isEqualTo("second");
    }

    @Test
    void testPoorerDuplicateIsIgnored() {
        String yang = """
                module merge {
                  prefix mg;
                  container first {
                    container timers {
                      leaf a { type uint8; }
                      leaf b { type uint8; }
                    }
                  }
                  container second {
                    container timers {
                      leaf a { type uint8; }
                      leaf b { type uint8; }
                    }
                  }
                }
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        GenerationContext ctx = YangFixtures.prepare(diagnostics, yang);

        StructCandidate timers = ctx.getStructRegistry().find(new StructKey("mg", "timers")).orElseThrow();
        assertThat(timers.getNode().getParent().getName()).isEqualTo("first");
    }

    @Test
    void testPresenceOnlyChoiceBecomesEnum() {
        String yang = """
                module pol {
                  prefix pl;
                  container actions {
                    choice route-disposition {
                      case accept-route {
                        leaf accept-route { type empty; }
                      }
                      case reject-route {
                        leaf reject-route { type empty; }
                      }
                    }
                  }
                }
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        GenerationContext ctx = YangFixtures.prepare(diagnostics, yang);

        TypedefDefinition choiceEnum = ctx.getTypedefRegistry().find("pl", "route-disposition").orElseThrow();
        assertThat(choiceEnum.getKind()).isEqualTo(TypedefDefinition.Kind.CHOICE_ENUM);
        assertThat(choiceEnum.getTypeName()).isEqualTo("RouteDisposition");
        assertThat(choiceEnum.getPath()).isEqualTo("/pl:actions/pl:route-disposition");

        NodeFacts facts = ctx.factsOf(choiceEnum.getNode());
        assertThat(facts.isEnumChoice()).isTrue();
        assertThat(ctx.getStructRegistry().candidates())
                .extracting(c -> c.getKey().getUniqueName())
                .containsExactly("actions");
    }

    @Test
    void testMixedChoiceBecomesStructWithFlattenedChildren() {
        String yang = """
                module pol {
                  prefix pl;
                  container actions {
                    choice target {
                      case by-name {
                        leaf name { type string; }
                      }
                      case by-id {
                        leaf id { type uint32; }
                        leaf enabled { type empty; }
                      }
                    }
                  }
                }
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        GenerationContext ctx = YangFixtures.prepare(diagnostics, yang);

        StructCandidate target = ctx.getStructRegistry().find(new StructKey("pl", "target")).orElseThrow();
        assertThat(target.getFacts().getEffectiveChildren())
                .extracting(SchemaNode::getName)
                .containsExactly("name", "id", "enabled");
        assertThat(ctx.factsOf(target.getFacts().getEffectiveChildren().get(1)).getPath())
                .isEqualTo("/pl:actions/pl:target/pl:by-id/pl:id");
    }

    @Test
    void testEmbeddedEnumerationIsRegistered() {
        String yang = """
                module st {
                  prefix st;
                  container session {
                    leaf session-state {
                      type enumeration {
                        enum IDLE;
                        enum ESTABLISHED;
                      }
                    }
                  }
                }
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        GenerationContext ctx = YangFixtures.prepare(diagnostics, yang);

        TypedefDefinition embedded = ctx.getTypedefRegistry().find("st", "session-state").orElseThrow();
        assertThat(embedded.getKind()).isEqualTo(TypedefDefinition.Kind.EMBEDDED_ENUM);
        assertThat(embedded.getTypeName()).isEqualTo("SessionState");
        assertThat(embedded.isEnumeration()).isTrue();
    }

    @Test
    void testStaticNamingRules() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        YangModule module = YangFixtures.build(diagnostics, NEIGHBOR).get(0);
        SchemaNode neighbor = module.findChild("neighbor").orElseThrow();
        SchemaNode config = neighbor.getChildren().get(0);

        assertThat(SchemaTreeVisitorService.uniqueNameOf(config, "peer", "nm")).isEqualTo("peer-config");
        assertThat(SchemaTreeVisitorService.uniqueNameOf(config, null, "nm")).isEqualTo("config");
        assertThat(SchemaTreeVisitorService.uniqueNameOf(neighbor, null, "nm")).isEqualTo("neighbor");
        assertThat(SchemaTreeVisitorService.structuralPath(config)).isEqualTo("/nm:neighbor/nm:config");
    }
}
