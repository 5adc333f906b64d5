package com.loon.core.assertion;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class whose frames are skipped when a failed assertion reports its
 * source location, so the report points at the test code that called into it.
 * Put it on assertion wrappers and plugin facades.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface AssertionHelper {}
