package com.quantori.cnp.core.rules;

import com.quantori.cnp.api.model.NamingPhase;
import com.quantori.cnp.core.configuration.NomenclatureTables;
import com.quantori.cnp.core.engine.NamingRule;
import com.quantori.cnp.core.engine.NamingTracer;
import com.quantori.cnp.core.engine.PhaseController;
import com.quantori.cnp.core.naming.NameAssembler;
import com.quantori.cnp.core.naming.RingNamer;
import com.quantori.cnp.core.naming.SubstituentNamer;
import com.quantori.cnp.core.numbering.LocantOptimizer;
import java.util.List;
import lombok.Getter;

/**
 * All naming rules, grouped by phase.
 */
@Getter
public class RuleCatalogue {

  private final List<NamingRule> parentStructureRules;
  private final List<NamingRule> numberingRules;
  private final List<NamingRule> assemblyRules;

  public RuleCatalogue(List<NamingRule> parentStructureRules, List<NamingRule> numberingRules,
                       List<NamingRule> assemblyRules) {
    this.parentStructureRules = List.copyOf(parentStructureRules);
    this.numberingRules = List.copyOf(numberingRules);
    this.assemblyRules = List.copyOf(assemblyRules);
  }

  public static RuleCatalogue create(NomenclatureTables tables) {
    RingNamer ringNamer = new RingNamer(tables);
    LocantOptimizer locantOptimizer = new LocantOptimizer();
    SubstituentNamer substituentNamer = new SubstituentNamer(tables, ringNamer, locantOptimizer);
    return new RuleCatalogue(
        new ParentStructureRules(tables, ringNamer, substituentNamer).rules(),
        new NumberingRules(locantOptimizer).rules(),
        new AssemblyRules(ringNamer, new NameAssembler()).rules());
  }

  /**
   * Creates one controller per phase, in execution order.
   *
   * @param tracer diagnostics sink shared by the controllers
   * @return phase controllers
   */
  public List<PhaseController> controllers(NamingTracer tracer) {
    return List.of(
        new PhaseController(NamingPhase.PARENT_STRUCTURE, parentStructureRules, tracer),
        new PhaseController(NamingPhase.NUMBERING, numberingRules, tracer),
        new PhaseController(NamingPhase.ASSEMBLY, assemblyRules, tracer));
  }
}
