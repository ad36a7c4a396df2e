package mtnclgen.synth;

/** Immutable settings threaded through one synthesis run. */
public final class SynthesisOptions {
  public static final SynthesisOptions DEFAULT = new SynthesisOptions(GatePreferences.NONE, PolymorphicOptions.DEFAULT, SearchBudget.DEFAULT);

  private final GatePreferences preferences;
  private final PolymorphicOptions polymorphic;
  private final SearchBudget budget;

  public SynthesisOptions(GatePreferences preferences, PolymorphicOptions polymorphic, SearchBudget budget) {
    this.preferences = preferences;
    this.polymorphic = polymorphic;
    this.budget = budget;
  }

  public GatePreferences getPreferences() { return preferences; }
  public PolymorphicOptions getPolymorphic() { return polymorphic; }
  public SearchBudget getBudget() { return budget; }
}
