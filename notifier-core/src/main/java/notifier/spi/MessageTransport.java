package notifier.spi;

/**
 * Performs the network call that posts a rendered message to the messaging endpoint.
 *
 * <p>Credentials and the HTTP client live in the implementation; the dispatcher only
 * supplies the destination, the text and the send options.
 *
 * <h2>Error Contract</h2>
 * <ul>
 *   <li>Return normally when the endpoint accepted the message.</li>
 *   <li>Throw {@link notifier.ThrottledException} when the endpoint rejected the call for
 *       exceeding its rate; the dispatcher waits and re-sends.</li>
 *   <li>Throw anything else for every other failure (network, invalid destination,
 *       malformed payload); the dispatcher logs it and reports the delivery as failed.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * MessageTransport transport = (chatId, text, options) -> {
 *   BotResponse response = client.sendMessage(chatId, text, options.parseMode().name());
 *   if (response.errorCode() == 429) {
 *     throw ThrottledException.ofSeconds(response.retryAfter());
 *   }
 *   if (!response.ok()) {
 *     throw new IOException(response.description());
 *   }
 * };
 * }</pre>
 */
@FunctionalInterface
public interface MessageTransport {

  /**
   * Sends one message.
   *
   * @param destination channel or chat identifier
   * @param text        message body, already escaped for {@code options.parseMode()}
   * @param options     formatting and preview options
   * @throws notifier.ThrottledException if the endpoint asked the caller to slow down
   * @throws Exception                   on any other delivery failure
   */
  void send(String destination, String text, SendOptions options) throws Exception;
}
