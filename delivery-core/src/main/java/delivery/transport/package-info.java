/**
 * Transport implementations. {@link delivery.transport.HttpTransport} posts payloads
 * with the JDK HTTP client.
 */
package delivery.transport;
