package ca.gc.cra.funnel.application.mode;

import ca.gc.cra.funnel.application.port.ChannelHandle;
import ca.gc.cra.funnel.domain.log.OperatingMode;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Decides the {@link OperatingMode} of a facade from its construction arguments.
 * <p><strong>Why:</strong> Keeps the topology decision in one pure function instead of spreading flag checks across
 * the facade.</p>
 * <p><strong>Decision table</strong> (evaluated in order):</p>
 * <ol>
 *   <li>multi-process not requested → {@link OperatingMode#STANDALONE}; a supplied channel is ignored.</li>
 *   <li>multi-process requested, no channel → {@link OperatingMode#AGGREGATION_OWNER}.</li>
 *   <li>multi-process requested, channel supplied → {@link OperatingMode#WORKER}.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class ModeResolver {
  private ModeResolver() {}

  /**
   * Resolves the operating mode.
   *
   * @param wantsMultiprocess whether the caller asked for cross-process aggregation
   * @param suppliedChannel channel handle received from an aggregation owner, if any
   * @return resolved mode
   */
  public static OperatingMode resolve(boolean wantsMultiprocess, Optional<ChannelHandle> suppliedChannel) {
    Objects.requireNonNull(suppliedChannel, "suppliedChannel");
    if (!wantsMultiprocess) {
      return OperatingMode.STANDALONE;
    }
    return suppliedChannel.isPresent() ? OperatingMode.WORKER : OperatingMode.AGGREGATION_OWNER;
  }
}
