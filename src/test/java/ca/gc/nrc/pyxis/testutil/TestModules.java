package ca.gc.nrc.pyxis.testutil;

import ca.gc.nrc.pyxis.application.module.AttributePolicy;
import ca.gc.nrc.pyxis.application.module.ModuleContext;
import ca.gc.nrc.pyxis.application.module.OutputPort;
import ca.gc.nrc.pyxis.application.module.ProcessingModule;
import ca.gc.nrc.pyxis.application.module.ReadingModule;
import ca.gc.nrc.pyxis.application.module.WritingModule;
import ca.gc.nrc.pyxis.domain.dataset.NdArray;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Small modules whose behaviour is supplied as a lambda.
 */
public final class TestModules {

  private TestModules() {}

  /** Module body. */
  @FunctionalInterface
  public interface Body {
    void run(ModuleContext context) throws Exception;
  }

  /**
   * Reading module writing {@code data} under {@code tag} on role {@code out}, then running {@code extra}.
   */
  public static ReadingModule reader(String name, String tag, NdArray data, Body extra) {
    return new ReadingModule() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public Map<String, String> outputs() {
        return Map.of("out", tag);
      }

      @Override
      public void run(ModuleContext context) throws Exception {
        OutputPort out = context.output("out");
        out.append(data);
        if (extra != null) {
          extra.run(context);
        }
      }
    };
  }

  public static ReadingModule reader(String name, String tag, NdArray data) {
    return reader(name, tag, data, null);
  }

  /**
   * Processing module with role {@code in} and role {@code out}.
   */
  public static ProcessingModule processor(String name, String inputTag, String outputTag, Body body) {
    return processor(name, Map.of("in", inputTag), Map.of("out", outputTag), Set.of(), AttributePolicy.COPY, body);
  }

  public static ProcessingModule processor(String name, Map<String, String> inputs, Map<String, String> outputs,
      Set<String> optionalRoles, AttributePolicy policy, Body body) {
    Map<String, String> in = new LinkedHashMap<>(inputs);
    Map<String, String> out = new LinkedHashMap<>(outputs);
    return new ProcessingModule() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public Map<String, String> inputs() {
        return in;
      }

      @Override
      public Map<String, String> outputs() {
        return out;
      }

      @Override
      public Set<String> optionalInputRoles() {
        return optionalRoles;
      }

      @Override
      public AttributePolicy propagation() {
        return policy;
      }

      @Override
      public void run(ModuleContext context) throws Exception {
        body.run(context);
      }
    };
  }

  /**
   * Writing module reading role {@code in}.
   */
  public static WritingModule writer(String name, String inputTag, Body body) {
    return new WritingModule() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public Map<String, String> inputs() {
        return Map.of("in", inputTag);
      }

      @Override
      public void run(ModuleContext context) throws Exception {
        body.run(context);
      }
    };
  }
}
