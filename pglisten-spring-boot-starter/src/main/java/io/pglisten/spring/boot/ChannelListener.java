package io.pglisten.spring.boot;

import io.pglisten.ListenPolicy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler of one notification channel.
 *
 * <p>The annotated bean must implement {@link io.pglisten.ChannelHandler}.
 *
 * <pre>{@code
 * @Component
 * @ChannelListener(channel = "orders", policy = ListenPolicy.LAST)
 * public class OrdersRefresher implements ChannelHandler {
 *   public void onEvent(ChannelEvent event) { ... }
 * }
 * }</pre>
 *
 * @see ChannelListenerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ChannelListener {

    /**
     * Channel name, matched exactly (case-sensitive).
     */
    String channel();

    /**
     * Buffering policy. Leave empty to use {@code pglisten.policy}; at most one value.
     */
    ListenPolicy[] policy() default {};
}
