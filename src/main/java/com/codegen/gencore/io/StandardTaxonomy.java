package com.codegen.gencore.io;

import com.codegen.gencore.engine.KindGraph;

/**
 * The built-in kind taxonomy of the generation pipeline: concept, sync,
 * interface and deploy sources, their intermediate models, and every emitted
 * artifact kind.
 */
public final class StandardTaxonomy {
    public static final String RESOURCE = "taxonomy/standard.json";

    public static final String CONCEPT_DSL = "ConceptDSL";
    public static final String CONCEPT_AST = "ConceptAST";
    public static final String CONCEPT_MANIFEST = "ConceptManifest";
    public static final String PROJECTION = "Projection";
    public static final String TYPESCRIPT_FILES = "TypeScriptFiles";

    private StandardTaxonomy() {
    }

    public static TaxonomyDefinition definition() {
        return new TaxonomyLoader().parseResource(RESOURCE);
    }

    /** Defines every standard kind and edge in {@code graph}. */
    public static TaxonomyLoader.LoadReport bootstrap(KindGraph graph) {
        TaxonomyLoader loader = new TaxonomyLoader();
        return loader.apply(loader.parseResource(RESOURCE), graph);
    }
}
