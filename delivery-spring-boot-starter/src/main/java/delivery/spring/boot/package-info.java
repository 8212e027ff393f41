/**
 * Spring Boot auto-configuration for the delivery queue.
 *
 * <p>Set {@code delivery.store-directory} and {@code delivery.http.endpoints.*} to get a
 * running {@link delivery.Delivery} bean.
 */
package delivery.spring.boot;
