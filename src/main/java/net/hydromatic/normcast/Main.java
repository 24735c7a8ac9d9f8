/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.normcast;

import com.google.common.collect.ImmutableList;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.normcast.compile.Classifier;
import net.hydromatic.normcast.compile.ClassifierComparison;
import net.hydromatic.normcast.compile.ClassifierFunction;
import net.hydromatic.normcast.compile.NormalizationCache;
import net.hydromatic.normcast.compile.Prop;
import net.hydromatic.normcast.compile.RewriteRule;
import net.hydromatic.normcast.compile.RuleException;
import net.hydromatic.normcast.compile.RuleRegistry;
import net.hydromatic.normcast.compile.StandardRules;
import net.hydromatic.normcast.compile.Tracer;
import net.hydromatic.normcast.compile.Tracers;
import net.hydromatic.normcast.type.NumericTower;
import net.hydromatic.normcast.type.TypeSystem;

/**
 * Command-line tool that registers the standard cast rules of the numeric
 * tower, and compares the labels inferred from their shapes with the labels
 * they were declared with.
 *
 * <p>Options:
 *
 * <ul>
 *   <li>{@code --trace} prints registration events;
 *   <li>{@code --strict} makes a declared label that conflicts with the
 *       inferred label an error.
 * </ul>
 */
public class Main {
  private final PrintWriter out;
  private final Map<Prop, Object> propMap;
  private final boolean trace;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(ImmutableList.copyOf(args),
            new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    try {
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Main. */
  public Main(List<String> argList, Writer out) {
    this.out = out instanceof PrintWriter
        ? (PrintWriter) out
        : new PrintWriter(out);
    this.propMap = new LinkedHashMap<>();
    boolean trace = false;
    for (String arg : argList) {
      switch (arg) {
        case "--trace":
          trace = true;
          break;
        case "--strict":
          Prop.STRICT_OVERRIDES.set(propMap, true);
          break;
        default:
          throw new IllegalArgumentException("unknown argument " + arg);
      }
    }
    this.trace = trace;
  }

  /** Registers the rules, and prints the comparison report. */
  public void run() {
    final TypeSystem typeSystem = NumericTower.create().typeSystem;
    final Tracer tracer =
        trace ? Tracers.printTracer(out) : Tracers.empty();
    final RuleRegistry registry =
        new RuleRegistry(typeSystem, propMap, tracer);
    final List<RuleException> errors =
        registry.registerAll(StandardRules.declarations(typeSystem));
    for (RuleException error : errors) {
      out.println("error: " + error.getMessage());
    }
    final NormalizationCache cache = registry.cache();
    final List<RewriteRule> rules =
        ImmutableList.<RewriteRule>builder()
            .addAll(NormalizationCache.relationalRules(typeSystem))
            .addAll(registry.rules())
            .build();
    final Classifier classifier = new Classifier(typeSystem);
    final ClassifierComparison.Report report =
        ClassifierComparison.compare(classifier::classify,
            ClassifierFunction.declared(), rules);
    out.println("rules: " + rules.size() + " (" + cache.up.size() + " up, "
        + cache.down.size() + " down, " + cache.squash.size() + " squash)");
    out.print(report);
    out.flush();
  }
}

// End Main.java
