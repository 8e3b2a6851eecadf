package com.uisafe.executor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as the {@link Interactor} for a given interaction context type.
 *
 * The {@link InteractorRegistry} scans the {@code com.uisafe.executor.interactors}
 * package at startup, finds every class annotated with {@code @InteractsWith}, and
 * registers it under the declared context type.
 *
 * <pre>
 *   {@literal @}InteractsWith(WebElement.class)
 *   public class AutoscrollWebInteractor extends RecoveringInteractor&lt;WebElement&gt; { ... }
 * </pre>
 *
 * Rules:
 *   - The annotated class must implement {@link Interactor}.
 *   - It must have either a constructor taking {@code UiSafeConfig} or a no-arg constructor.
 *   - Each context type may have at most one annotated interactor. Duplicates cause startup failure.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface InteractsWith {
    Class<?> value();
}
