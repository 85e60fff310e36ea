package io.b2mash.transport.backoffice.mission.spawn;

import io.b2mash.transport.backoffice.quote.LineOverrides;
import io.b2mash.transport.backoffice.quote.QuoteLine;
import java.util.List;
import java.util.UUID;

/** A quote line placed in its tree. Only GROUP nodes carry children. */
public sealed interface LineNode
    permits LineNode.CalculatedLine, LineNode.GroupLine, LineNode.ManualLine {

  QuoteLine line();

  default UUID id() {
    return line().getId();
  }

  default boolean dispatchable() {
    return line().isDispatchable();
  }

  default LineOverrides overrides() {
    return LineOverrides.from(line().getSourceData());
  }

  static LineNode of(QuoteLine line, List<LineNode> children) {
    return switch (line.getType()) {
      case CALCULATED -> new CalculatedLine(line);
      case GROUP -> new GroupLine(line, List.copyOf(children));
      case MANUAL -> new ManualLine(line);
    };
  }

  record CalculatedLine(QuoteLine line) implements LineNode {}

  record GroupLine(QuoteLine line, List<LineNode> children) implements LineNode {}

  record ManualLine(QuoteLine line) implements LineNode {}
}
