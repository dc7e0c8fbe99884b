package com.ttennebkram.enhancer.processors;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for EnhancementProcessor classes to declare their metadata.
 * Used for auto-registration at runtime - no compile-time registration needed.
 *
 * Example usage:
 * <pre>
 * {@literal @}EnhancementProcessorInfo(
 *     algorithm = "ContrastGamma",
 *     displayName = "Contrast + Gamma",
 *     description = "CLAHE on Lab luminance, then gamma correction"
 * )
 * public class ContrastGammaProcessor extends EnhancementProcessorBase { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface EnhancementProcessorInfo {

    /**
     * The algorithm id (e.g., "ContrastGamma", "ToneMapDrago").
     * Must match the id used in configuration.
     */
    String algorithm();

    /**
     * Human readable name. If empty, defaults to the algorithm id.
     */
    String displayName() default "";

    /**
     * Description/method signature.
     */
    String description() default "";
}
