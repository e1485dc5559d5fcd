package com.yang.generator.codegen.model.core.context;

import java.nio.file.Path;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one generation run.
 *
 * The exclusion lists start from the defaults below; CLI options add to them.
 */
@Data
@Builder
public class GeneratorConfig {

    /** Modules that contribute type information but never emit definitions. */
    public static final List<String> DEFAULT_EXCLUDED_MODULES = List.of(
            "ietf-inet-types",
            "ietf-yang-types"
    );

    /** Struct fields whose structural path is listed here are not emitted. */
    public static final List<String> DEFAULT_EXCLUDED_PATHS = List.of(
            "/rpol:routing-policy/rpol:defined-sets/rpol:neighbor-sets/rpol:neighbor-set/rpol:neighbor",
            "/rpol:routing-policy/rpol:defined-sets/bgp-pol:bgp-defined-sets/bgp-pol:community-sets"
                    + "/bgp-pol:community-set/bgp-pol:community-member",
            "/rpol:routing-policy/rpol:defined-sets/bgp-pol:bgp-defined-sets/bgp-pol:ext-community-sets"
                    + "/bgp-pol:ext-community-set/bgp-pol:ext-community-member",
            "/rpol:routing-policy/rpol:defined-sets/bgp-pol:bgp-defined-sets/bgp-pol:as-path-sets"
                    + "/bgp-pol:as-path-set/bgp-pol:as-path-set-member"
    );

    /** Typedefs whose path is listed here get no alias (the translation table covers them). */
    public static final List<String> DEFAULT_EXCLUDED_TYPEDEFS = List.of(
            "/gobgp:bgp-capability",
            "/gobgp:bgp-open-message"
    );

    public static final String DEFAULT_COPYRIGHT_HOLDER = "The RustyBGP Authors";

    public static final String GENERATOR_NAME = "yang-rust-generator";

    /** YANG files to translate. */
    @Builder.Default
    private List<Path> inputFiles = new ArrayList<>();

    /** Directories searched for imported modules. */
    @Builder.Default
    private List<Path> searchDirs = new ArrayList<>();

    /** Output file; null writes to standard output. */
    private Path outputFile;

    /** Whether to overwrite an existing output file. */
    private boolean force;

    /** Whether warnings fail the run. */
    private boolean failOnWarnings;

    @Builder.Default
    private List<String> excludedModules = new ArrayList<>(DEFAULT_EXCLUDED_MODULES);

    @Builder.Default
    private List<String> excludedPaths = new ArrayList<>(DEFAULT_EXCLUDED_PATHS);

    @Builder.Default
    private List<String> excludedTypedefs = new ArrayList<>(DEFAULT_EXCLUDED_TYPEDEFS);

    @Builder.Default
    private String copyrightHolder = DEFAULT_COPYRIGHT_HOLDER;

    @Builder.Default
    private int copyrightYear = Year.now().getValue();

    /**
     * Configuration with defaults only, for library use.
     */
    public static GeneratorConfig defaults() {
        return GeneratorConfig.builder().build();
    }
}
