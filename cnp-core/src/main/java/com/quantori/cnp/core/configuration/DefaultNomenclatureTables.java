package com.quantori.cnp.core.configuration;

import java.util.List;
import lombok.experimental.UtilityClass;

/**
 * Built-in rule data used when no configuration resource is available.
 */
@UtilityClass
public class DefaultNomenclatureTables {

  public static final String CARBOXYLIC_ACID = "carboxylic_acid";
  public static final String ESTER = "ester";
  public static final String AMIDE = "amide";
  public static final String NITRILE = "nitrile";
  public static final String ALDEHYDE = "aldehyde";
  public static final String KETONE = "ketone";
  public static final String ALCOHOL = "alcohol";
  public static final String AMINE = "amine";
  public static final String ETHER = "ether";

  public static NomenclatureTables create() {
    return NomenclatureTables.builder()
        .functionalGroups(functionalGroups())
        .heterocycles(heterocycles())
        .hydrides(hydrides())
        .build();
  }

  public static List<FunctionalGroupDefinition> functionalGroups() {
    return List.of(
        FunctionalGroupDefinition.builder()
            .type(CARBOXYLIC_ACID).name("carboxylic acid").pattern("[CX3](=O)[OX2H1]").coreIndexes(List.of(0, 1, 2))
            .prefix("carboxy").suffix("oic acid").attachedSuffix("carboxylic acid")
            .priority(1).principal(true).terminal(true).build(),
        FunctionalGroupDefinition.builder()
            .type(ESTER).name("ester").pattern("[CX3](=O)[OX2][#6]").coreIndexes(List.of(0, 1, 2))
            .prefix("oxycarbonyl").suffix("oate").attachedSuffix("carboxylate")
            .priority(2).principal(true).terminal(true).build(),
        FunctionalGroupDefinition.builder()
            .type(AMIDE).name("amide").pattern("[CX3](=O)[NX3]").coreIndexes(List.of(0, 1, 2))
            .prefix("carbamoyl").suffix("amide").attachedSuffix("carboxamide")
            .priority(3).principal(true).terminal(true).nitrogenLocant(true).build(),
        FunctionalGroupDefinition.builder()
            .type(NITRILE).name("nitrile").pattern("[CX2]#[NX1]").coreIndexes(List.of(0, 1))
            .prefix("cyano").suffix("nitrile").attachedSuffix("carbonitrile")
            .priority(4).principal(true).terminal(true).build(),
        FunctionalGroupDefinition.builder()
            .type(ALDEHYDE).name("aldehyde").pattern("[CX3;H1,H2]=O").coreIndexes(List.of(0, 1))
            .prefix("formyl").suffix("al").attachedSuffix("carbaldehyde")
            .priority(5).principal(true).terminal(true).build(),
        FunctionalGroupDefinition.builder()
            .type(KETONE).name("ketone").pattern("[#6][CX3](=O)[#6]").coreIndexes(List.of(1, 2))
            .prefix("oxo").suffix("one")
            .priority(6).principal(true).build(),
        FunctionalGroupDefinition.builder()
            .type(ALCOHOL).name("alcohol").pattern("[#6][OX2H]").coreIndexes(List.of(1))
            .prefix("hydroxy").suffix("ol")
            .priority(7).principal(true).build(),
        FunctionalGroupDefinition.builder()
            .type(AMINE).name("amine").pattern("[#6][NX3]").coreIndexes(List.of(1))
            .prefix("amino").suffix("amine")
            .priority(9).principal(true).nitrogenLocant(true).build(),
        FunctionalGroupDefinition.builder()
            .type(ETHER).name("ether").pattern("[#6][OX2][#6]").coreIndexes(List.of(1))
            .prefix("oxy")
            .priority(10).principal(false).build()
    );
  }

  public static List<HeterocycleName> heterocycles() {
    return List.of(
        new HeterocycleName(3, false, "O", 0, "oxirane"),
        new HeterocycleName(3, false, "N", 0, "aziridine"),
        new HeterocycleName(3, false, "S", 0, "thiirane"),
        new HeterocycleName(3, false, "NN", 0, "diaziridine"),
        new HeterocycleName(4, false, "O", 0, "oxetane"),
        new HeterocycleName(4, false, "N", 0, "azetidine"),
        new HeterocycleName(4, false, "S", 0, "thietane"),
        new HeterocycleName(5, false, "O", 0, "oxolane"),
        new HeterocycleName(5, false, "N", 0, "pyrrolidine"),
        new HeterocycleName(5, false, "S", 0, "thiolane"),
        new HeterocycleName(5, false, "NN", 1, "pyrazolidine"),
        new HeterocycleName(5, false, "NN", 2, "imidazolidine"),
        new HeterocycleName(5, false, "OO", 2, "1,3-dioxolane"),
        new HeterocycleName(6, false, "O", 0, "oxane"),
        new HeterocycleName(6, false, "N", 0, "piperidine"),
        new HeterocycleName(6, false, "S", 0, "thiane"),
        new HeterocycleName(6, false, "NN", 3, "piperazine"),
        new HeterocycleName(6, false, "NO", 3, "morpholine"),
        new HeterocycleName(6, false, "OO", 2, "1,3-dioxane"),
        new HeterocycleName(6, false, "OO", 3, "1,4-dioxane"),
        new HeterocycleName(7, false, "O", 0, "oxepane"),
        new HeterocycleName(7, false, "N", 0, "azepane"),
        new HeterocycleName(7, false, "S", 0, "thiepane"),
        new HeterocycleName(5, true, "O", 0, "furan"),
        new HeterocycleName(5, true, "N", 0, "pyrrole"),
        new HeterocycleName(5, true, "S", 0, "thiophene"),
        new HeterocycleName(5, true, "NN", 1, "pyrazole"),
        new HeterocycleName(5, true, "NN", 2, "imidazole"),
        new HeterocycleName(5, true, "NO", 1, "1,2-oxazole"),
        new HeterocycleName(5, true, "NO", 2, "1,3-oxazole"),
        new HeterocycleName(5, true, "NS", 1, "1,2-thiazole"),
        new HeterocycleName(5, true, "NS", 2, "1,3-thiazole"),
        new HeterocycleName(5, true, "NNN", 0, "triazole"),
        new HeterocycleName(5, true, "NNNN", 0, "tetrazole"),
        new HeterocycleName(6, true, "N", 0, "pyridine"),
        new HeterocycleName(6, true, "NN", 1, "pyridazine"),
        new HeterocycleName(6, true, "NN", 2, "pyrimidine"),
        new HeterocycleName(6, true, "NN", 3, "pyrazine"),
        new HeterocycleName(6, true, "NNN", 0, "triazine")
    );
  }

  public static List<HydrideName> hydrides() {
    return List.of(
        new HydrideName("B", 3, "borane", "boranyl"),
        new HydrideName("Si", 4, "silane", "silyl"),
        new HydrideName("Ge", 4, "germane", "germyl"),
        new HydrideName("Sn", 4, "stannane", "stannyl"),
        new HydrideName("Pb", 4, "plumbane", "plumbyl"),
        new HydrideName("P", 3, "phosphane", "phosphanyl"),
        new HydrideName("As", 3, "arsane", "arsanyl"),
        new HydrideName("Sb", 3, "stibane", "stibanyl"),
        new HydrideName("Bi", 3, "bismuthane", "bismuthanyl")
    );
  }
}
