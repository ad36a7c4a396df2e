package mtnclgen.circuit;

import java.util.Arrays;
import mtnclgen.gatelib.GateTemplate;

/** An instantiated gate: input pin i is bound to net {@code inputs[i]}. */
public final class CircuitNode {
  private final int id;
  private final String instanceName;
  private final GateTemplate template;
  private final int[] inputs;
  private final int output;

  public CircuitNode(int id, String instanceName, GateTemplate template, int[] inputs, int output) {
    this.id = id;
    this.instanceName = instanceName;
    this.template = template;
    this.inputs = inputs.clone();
    this.output = output;
  }

  public int getId() { return id; }
  public String getInstanceName() { return instanceName; }
  public GateTemplate getTemplate() { return template; }
  public int getInputCount() { return inputs.length; }
  public int getInput(int pin) { return inputs[pin]; }
  public int[] getInputs() { return inputs.clone(); }
  public int getOutput() { return output; }

  @Override
  public String toString() {
    return instanceName + ":" + template.getName() + Arrays.toString(inputs) + "->" + output;
  }
}
