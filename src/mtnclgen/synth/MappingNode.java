package mtnclgen.synth;

import java.util.List;
import mtnclgen.gatelib.GateMatch;

/**
 * One gate of a cover: the matched template and what drives each of its signals.
 * Signal i of the match is driven by {@code getInputs().get(i)}.
 */
public final class MappingNode {
  /** A primary input variable or the output of another mapped gate. */
  public static final class Input {
    private final String variable;
    private final MappingNode gate;

    private Input(String variable, MappingNode gate) {
      this.variable = variable;
      this.gate = gate;
    }

    public static Input variable(String name) { return new Input(name, null); }
    public static Input gate(MappingNode node) { return new Input(null, node); }

    public boolean isVariable() { return variable != null; }
    public String getVariable() { return variable; }
    public MappingNode getGate() { return gate; }

    @Override
    public String toString() {
      return isVariable() ? variable : gate.toString();
    }
  }

  private final GateMatch match;
  private final List<Input> inputs;

  public MappingNode(GateMatch match, List<Input> inputs) {
    if (inputs.size() != match.getTemplate().getArity())
      throw new IllegalArgumentException("Gate " + match.getTemplate().getName() + " needs " + match.getTemplate().getArity() + " signals");
    this.match = match;
    this.inputs = List.copyOf(inputs);
  }

  public GateMatch getMatch() { return match; }
  public List<Input> getInputs() { return inputs; }

  public int gateCount() {
    int count = 1;
    for (Input in : inputs)
      if (!in.isVariable())
        count += in.getGate().gateCount();
    return count;
  }

  @Override
  public String toString() {
    return match.getTemplate().getName() + inputs;
  }
}
