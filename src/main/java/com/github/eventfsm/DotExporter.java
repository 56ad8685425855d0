package com.github.eventfsm;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.eventfsm.StateMachineSnapshot.HookView;
import com.github.eventfsm.StateMachineSnapshot.TransitionView;

/**
 * Renders a {@link StateMachineSnapshot} as a Graphviz digraph.
 * 
 * Every labelled state becomes a node, the initial state drawn as a diamond. States with an entry or
 * exit hook get an extra dashed "shadow" node per hook so that the hook can be drawn as an edge of
 * its own. Transitions are labelled with their name and the event label.
 * 
 * Only states present in the state label map are drawn; edges touching other states still reference
 * them by label and graphviz will create plain nodes for those.
 */
public final class DotExporter<S, E> {
  private static final Logger logger = LogManager.getLogger(DotExporter.class.getSimpleName());

  static final String unknownLabel = "?";

  private final Map<S, String> stateLabels;
  private final Map<E, String> eventLabels;

  public DotExporter(final Map<S, String> stateLabels, final Map<E, String> eventLabels) {
    if (stateLabels == null || eventLabels == null) {
      throw new IllegalArgumentException("State and event label maps are required");
    }
    this.stateLabels = stateLabels;
    this.eventLabels = eventLabels;
  }

  /**
   * Write the dot representation to the destination file, or to stdout when there's none. Fails if
   * the file cannot be created.
   */
  public void export(final StateMachineSnapshot<S, E> snapshot, final Optional<Path> destination)
      throws IOException {
    final String dot = render(snapshot);
    if (destination != null && destination.isPresent()) {
      try (final Writer writer =
          Files.newBufferedWriter(destination.get(), StandardCharsets.UTF_8)) {
        writer.write(dot);
      }
      logger.info("Wrote dot graph of " + snapshot.getMachineName() + " to " + destination.get());
    } else {
      final Writer writer = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
      writer.write(dot);
      // stdout is not ours to close
      writer.flush();
    }
  }

  public String render(final StateMachineSnapshot<S, E> snapshot) {
    final Map<S, String> nodeIds = new LinkedHashMap<>();
    final Map<EntryExitKey<S>, String> shadowIds = new LinkedHashMap<>();
    final StringBuilder dot = new StringBuilder();
    dot.append("digraph G").append(UUID.randomUUID().toString().replace("-", "")).append(" {\n");

    // real nodes first, then the shadow nodes of their hooks
    int nodeCount = 0;
    for (final Map.Entry<S, String> state : stateLabels.entrySet()) {
      final String nodeId = "N" + nodeCount++;
      nodeIds.put(state.getKey(), nodeId);
      final boolean initial = state.getKey().equals(snapshot.getInitialState());
      dot.append("    ").append(nodeId).append("[label=").append(quote(label(state.getValue())))
          .append("][shape=\"").append(initial ? "diamond" : "oval").append("\"];\n");
      for (final Direction direction : Direction.values()) {
        if (snapshot.hasHook(state.getKey(), direction)) {
          final String shadowId = "N" + nodeCount++;
          shadowIds.put(EntryExitKey.of(state.getKey(), direction), shadowId);
          dot.append("    ").append(shadowId).append("[label=")
              .append(quote(direction == Direction.ENTER ? "Enter" : "Exit"))
              .append("][style=\"dashed\"][shape=\"plain\"];\n");
        }
      }
    }

    for (final TransitionView<S, E> transition : snapshot.getTransitions()) {
      final String label = transition.getName().orElse("") + "\n|"
          + eventLabels.getOrDefault(transition.getEvent(), "") + "|";
      dot.append("    ").append(nodeId(nodeIds, transition.getState())).append(" -> ")
          .append(nodeId(nodeIds, transition.getTargetState())).append("[label=")
          .append(quote(label)).append("];\n");
    }

    for (final HookView<S> hook : snapshot.getHooks()) {
      final String shadowId =
          shadowIds.get(EntryExitKey.of(hook.getState(), hook.getDirection()));
      if (shadowId == null) {
        // hook on a state that has no label, nothing to attach it to
        continue;
      }
      final String stateId = nodeId(nodeIds, hook.getState());
      final String source = hook.getDirection() == Direction.ENTER ? shadowId : stateId;
      final String target = hook.getDirection() == Direction.ENTER ? stateId : shadowId;
      dot.append("    ").append(source).append(" -> ").append(target).append("[label=")
          .append(quote(hook.getName().orElse(""))).append("];\n");
    }
    dot.append("}\n");
    return dot.toString();
  }

  private String nodeId(final Map<S, String> nodeIds, final S state) {
    final String nodeId = nodeIds.get(state);
    return nodeId != null ? nodeId : quote(String.valueOf(state));
  }

  private static String label(final String label) {
    return label != null ? label : unknownLabel;
  }

  private static String quote(final String text) {
    return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
  }

}
