/**
 * Spring Boot auto-configuration for the membership engine.
 *
 * <p>{@link membership.spring.boot.MembershipAutoConfiguration} wires the JDBC stores
 * and a {@link membership.MembershipManager} from {@code membership.*} application
 * properties; the application supplies the mail and group collaborators.
 *
 * @see membership.spring.boot.MembershipAutoConfiguration
 * @see membership.spring.boot.MembershipProperties
 */
package membership.spring.boot;
