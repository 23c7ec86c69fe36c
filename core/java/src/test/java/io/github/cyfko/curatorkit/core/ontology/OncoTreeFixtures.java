package io.github.cyfko.curatorkit.core.ontology;

import io.github.cyfko.curatorkit.core.lookup.ResourceTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Small ontology shared by the ontology and rewrite tests.
 * <pre>
 * Lung (LUNG)
 *   Non-Small Cell Lung Cancer (NSCLC)
 *     Lung Adenocarcinoma (LUAD)
 *     Lung Squamous Cell Carcinoma (LUSC)
 *   Small Cell Lung Cancer (SCLC)
 * Breast (BREAST)
 *   Invasive Breast Carcinoma (BRCA)
 * </pre>
 */
public final class OncoTreeFixtures {

    private OncoTreeFixtures() {
    }

    public static List<String> levelHeader() {
        List<String> header = new ArrayList<>();
        for (int level = 1; level <= OncoTree.MAX_LEVEL; level++) {
            header.add(OncoTree.LEVEL_COLUMN_PREFIX + level);
        }
        header.add("metamaintype");
        return header;
    }

    public static ResourceTable table(List<List<String>> rows) {
        return new ResourceTable("oncotree", levelHeader(), rows);
    }

    public static OncoTree lungAndBreast() {
        return OncoTree.fromTable(table(List.of(
                List.of("Lung (LUNG)", "Non-Small Cell Lung Cancer (NSCLC)", "Lung Adenocarcinoma (LUAD)"),
                List.of("Lung (LUNG)", "Non-Small Cell Lung Cancer (NSCLC)", "Lung Squamous Cell Carcinoma (LUSC)"),
                List.of("Lung (LUNG)", "Small Cell Lung Cancer (SCLC)"),
                List.of("Breast (BREAST)", "Invasive Breast Carcinoma (BRCA)"))));
    }
}
