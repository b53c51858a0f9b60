package com.quantori.cnp.core.naming;

import com.quantori.cnp.core.configuration.DefaultNomenclatureTables;
import com.quantori.cnp.core.model.FunctionalGroup;
import com.quantori.cnp.core.model.NomenclatureMode;
import com.quantori.cnp.core.model.ParentStructure;
import com.quantori.cnp.core.model.Substituent;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a numbered parent structure and its groups into the final name.
 * <ol>
 *   <li>collects the prefixes: substituents, then groups no substituent covers</li>
 *   <li>drops prefixes already spelled out by the parent name</li>
 *   <li>formats and alphabetizes the prefixes, citing locants unless they are implied</li>
 *   <li>appends the principal suffix with elision of the parent's final "e" and its multiplied locants, or
 *   substitutes a retained name</li>
 *   <li>normalizes hyphens and case</li>
 * </ol>
 * Esters in functional class mode are named as "{alkyl} {anion}".
 */
public class NameAssembler {

  public String assemble(ParentStructure parent, List<FunctionalGroup> groups, NomenclatureMode mode) {
    FunctionalGroup principal = groups.stream().filter(FunctionalGroup::isPrincipal).findFirst().orElse(null);
    String baseName = parent.getName();

    List<Fragment> fragments = withoutContained(fragments(parent, groups), baseName);
    boolean showLocants = showPrefixLocants(parent, fragments, principal);
    String prefix = FragmentFormatter.format(fragments, showLocants, !parent.isHeteroatom());
    String unlocatedPrefix = FragmentFormatter.format(fragments, false, !parent.isHeteroatom());
    boolean ester = principal != null && DefaultNomenclatureTables.ESTER.equals(principal.getType());

    String name;
    if (principal == null) {
      name = joinPrefix(prefix, baseName);
    } else if (retainedAcid(parent, principal, fragments) != null) {
      String retained = retainedAcid(parent, principal, fragments);
      name = joinPrefix(parent.size() == 2 ? unlocatedPrefix : prefix, retained);
    } else if (ester && retainedAnion(parent, principal, fragments) != null) {
      name = joinPrefix(unlocatedPrefix, retainedAnion(parent, principal, fragments));
    } else if (parent.getRetainedName() != null) {
      name = joinPrefix(prefix, parent.getRetainedName());
    } else {
      name = joinPrefix(prefix, suffixed(parent, principal, fragments));
    }

    if (ester && mode == NomenclatureMode.FUNCTIONAL_CLASS) {
      name = FunctionalClassAssembler.assemble(principal.getAlkylComponents(), NameFormatter.format(name));
    }
    return NameFormatter.format(name);
  }

  List<Fragment> fragments(ParentStructure parent, List<FunctionalGroup> groups) {
    List<Fragment> fragments = new ArrayList<>();
    for (Substituent substituent : parent.getSubstituents()) {
      String locant = substituent.getHeteroLocant() != null
          ? substituent.getHeteroLocant()
          : parent.label(substituent.getLocant());
      fragments.add(new Fragment(substituent.getName(), locant, substituent.isCompound()));
    }
    for (FunctionalGroup group : groups) {
      if (group.isPrincipal() || group.getPrefix() == null || group.isCitedBy(parent.getSubstituents())) {
        continue;
      }
      for (int locant : group.getLocants()) {
        fragments.add(new Fragment(group.getPrefix(), parent.label(locant), false));
      }
    }
    return fragments;
  }

  private static List<Fragment> withoutContained(List<Fragment> fragments, String baseName) {
    String normalizedBase = normalize(baseName);
    return fragments.stream()
        .filter(fragment -> {
          String normalized = normalize(fragment.name());
          return normalized.length() < 4 || !normalizedBase.contains(normalized);
        })
        .toList();
  }

  private static boolean showPrefixLocants(ParentStructure parent, List<Fragment> fragments,
                                           FunctionalGroup principal) {
    if (parent.isHeteroatom() || parent.size() == 1) {
      return false;
    }
    boolean lone = fragments.size() == 1 && !fragments.get(0).isHeteroLocant();
    return !(lone && principal == null && (parent.isSymmetric() || (parent.isChain() && parent.size() == 2)));
  }

  private static String retainedAcid(ParentStructure parent, FunctionalGroup principal, List<Fragment> fragments) {
    if (!DefaultNomenclatureTables.CARBOXYLIC_ACID.equals(principal.getType()) || !isPlainChainAcyl(parent, principal)) {
      return null;
    }
    if (parent.size() == 1 && fragments.isEmpty()) {
      return "formic acid";
    }
    if (parent.size() == 2) {
      return "acetic acid";
    }
    if (parent.size() == 3 && fragments.isEmpty()) {
      return "propionic acid";
    }
    return null;
  }

  private static String retainedAnion(ParentStructure parent, FunctionalGroup principal, List<Fragment> fragments) {
    if (!isPlainChainAcyl(parent, principal)) {
      return null;
    }
    if (parent.size() == 1 && fragments.isEmpty()) {
      return "formate";
    }
    if (parent.size() == 2) {
      return "acetate";
    }
    return null;
  }

  private static boolean isPlainChainAcyl(ParentStructure parent, FunctionalGroup principal) {
    return parent.isChain() && principal.getMultiplicity() == 1 && principal.isIncorporated()
        && parent.getMultipleBonds().isEmpty();
  }

  private static String suffixed(ParentStructure parent, FunctionalGroup principal, List<Fragment> fragments) {
    String ending = Vocabulary.simpleMultiplier(principal.getMultiplicity()) + principal.principalSuffix();
    String base = parent.getName();
    if (base.endsWith("e") && Vocabulary.startsWithVowel(ending)) {
      base = base.substring(0, base.length() - 1);
    }
    if (omitPrincipalLocants(parent, principal, fragments)) {
      return base + ending;
    }
    String locants = principal.getLocants().stream()
        .sorted()
        .map(parent::label)
        .collect(Collectors.joining(","));
    return base + "-" + locants + "-" + ending;
  }

  private static boolean omitPrincipalLocants(ParentStructure parent, FunctionalGroup principal,
                                              List<Fragment> fragments) {
    List<Integer> locants = principal.getLocants();
    if (parent.isHeteroatom() || locants.isEmpty() || (parent.isChain() && parent.size() == 1)) {
      return true;
    }
    boolean carbonPrefixes = fragments.stream().anyMatch(fragment -> !fragment.isHeteroLocant());
    if (parent.isChain() && parent.size() == 2 && !carbonPrefixes
        && locants.stream().allMatch(locant -> locant == 1)) {
      return true;
    }
    if (parent.isChain() && principal.isTerminal() && principal.isIncorporated()
        && locants.stream().allMatch(locant -> locant == 1 || locant == parent.size())) {
      return true;
    }
    return parent.isSymmetric() && principal.getMultiplicity() == 1 && fragments.isEmpty();
  }

  static String joinPrefix(String prefix, String rest) {
    if (prefix.isEmpty()) {
      return rest;
    }
    if (!rest.isEmpty() && Character.isDigit(rest.charAt(0))) {
      return prefix + "-" + rest;
    }
    return prefix + rest;
  }

  private static String normalize(String text) {
    return text.replaceAll("[^a-zA-Z]", "").toLowerCase();
  }
}
