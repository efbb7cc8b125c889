package notifier.render;

/**
 * Escapes the five markup-significant characters to their HTML entities.
 */
public final class HtmlEscaper {

  private HtmlEscaper() {}

  /**
   * Escapes {@code & < > " '} in {@code text}.
   *
   * @param text raw, untrusted text
   * @return text safe for embedding in HTML content
   */
  public static String escape(String text) {
    StringBuilder sb = null;
    for (int i = 0; i < text.length(); i++) {
      String replacement = replacementFor(text.charAt(i));
      if (replacement == null) {
        if (sb != null) {
          sb.append(text.charAt(i));
        }
        continue;
      }
      if (sb == null) {
        sb = new StringBuilder(text.length() + 16);
        sb.append(text, 0, i);
      }
      sb.append(replacement);
    }
    return sb == null ? text : sb.toString();
  }

  private static String replacementFor(char c) {
    switch (c) {
      case '&': return "&amp;";
      case '<': return "&lt;";
      case '>': return "&gt;";
      case '"': return "&quot;";
      case '\'': return "&#39;";
      default: return null;
    }
  }
}
