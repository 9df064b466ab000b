package io.github.joke.wireform.di;

import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import javax.inject.Scope;

/** One instance per processing round. */
@Scope
@Documented
@Retention(RUNTIME)
public @interface RoundScoped {}
