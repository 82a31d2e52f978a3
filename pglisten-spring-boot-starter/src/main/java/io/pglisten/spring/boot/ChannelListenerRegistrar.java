package io.pglisten.spring.boot;

import io.pglisten.ChannelHandler;
import io.pglisten.ChannelRegistration;
import io.pglisten.ListenPolicy;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link ChannelListener} and registers them in the
 * {@link ChannelListenerRegistry}. {@link ChannelRegistration} beans are registered as-is.
 *
 * <p>Runs after all singleton beans are initialized, before the listener lifecycle starts.
 */
public class ChannelListenerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final ChannelListenerRegistry registry;
    private final ListenPolicy defaultPolicy;

    public ChannelListenerRegistrar(ListableBeanFactory beanFactory, ChannelListenerRegistry registry,
                                    ListenPolicy defaultPolicy) {
        this.beanFactory = beanFactory;
        this.registry = registry;
        this.defaultPolicy = defaultPolicy;
    }

    @Override
    public void afterSingletonsInstantiated() {
        for (ChannelRegistration registration : beanFactory.getBeansOfType(ChannelRegistration.class).values()) {
            registry.register(registration);
        }

        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(ChannelListener.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof ChannelHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @ChannelListener must implement ChannelHandler, "
                                + "but " + bean.getClass().getName() + " does not");
            }
            // proxies may hide the annotation on the target class
            ChannelListener annotation = AnnotationUtils.findAnnotation(bean.getClass(), ChannelListener.class);
            if (annotation == null) {
                annotation = beanFactory.findAnnotationOnBean(beanName, ChannelListener.class);
            }
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @ChannelListener annotation on " + bean.getClass().getName());
            }

            try {
                registry.register(new ChannelRegistration(annotation.channel(), handler,
                        resolvePolicy(beanName, annotation)));
            } catch (IllegalArgumentException | IllegalStateException e) {
                throw new BeanCreationException(beanName, "Invalid @ChannelListener: " + e.getMessage(), e);
            }
        }
    }

    private ListenPolicy resolvePolicy(String beanName, ChannelListener annotation) {
        ListenPolicy[] policy = annotation.policy();
        if (policy.length == 0) {
            return defaultPolicy;
        }
        if (policy.length > 1) {
            throw new BeanCreationException(beanName, "@ChannelListener accepts at most one policy");
        }
        return policy[0];
    }
}
