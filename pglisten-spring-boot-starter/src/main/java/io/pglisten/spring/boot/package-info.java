/**
 * Spring Boot auto-configuration: binds {@code pglisten.*} properties, registers
 * {@link io.pglisten.spring.boot.ChannelListener} beans and ties the listener run to the
 * application context lifecycle.
 */
package io.pglisten.spring.boot;
