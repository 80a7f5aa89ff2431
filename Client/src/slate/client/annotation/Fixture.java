package slate.client.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a static method as a fixture factory.
 *
 * The method's parameters are its dependencies, each annotated with {@link Use}; a parameter of type
 * {@link slate.core.fixture.FixtureContext} receives the construction context instead. A returned value that is
 * {@link AutoCloseable} is closed when its scope activation closes.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Fixture {

    /**
     * The fixture name. Defaults to the method name.
     */
    String value() default "";

    /**
     * The scope name: {@code test}, {@code module}, {@code session} or the name of a custom scope.
     */
    String scope() default "test";

    /**
     * The nesting level of a custom scope, strictly between the test and module levels. Ignored for built-in scopes.
     */
    int level() default -1;
}
