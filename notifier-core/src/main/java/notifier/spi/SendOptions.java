package notifier.spi;

import java.util.Objects;

/**
 * Per-message options passed to {@link MessageTransport#send}.
 *
 * @param parseMode           how the endpoint should interpret the text
 * @param linkPreviewDisabled whether link previews must be suppressed
 */
public record SendOptions(ParseMode parseMode, boolean linkPreviewDisabled) {

  /** Rich-text mode restricted to the tags the renderer emits, previews off. */
  public static final SendOptions HTML_WITHOUT_PREVIEW = new SendOptions(ParseMode.HTML, true);

  public SendOptions {
    Objects.requireNonNull(parseMode, "parseMode");
  }

  /** Text interpretation requested from the endpoint. */
  public enum ParseMode {
    PLAIN,
    HTML
  }
}
