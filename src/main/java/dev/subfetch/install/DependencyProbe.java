package dev.subfetch.install;

/** Checks whether a dependency stage can be used right now */
@FunctionalInterface
public interface DependencyProbe {

	/** Must not throw; a probe that cannot tell reports the stage as unavailable */
	boolean isAvailable(Stage stage);
}
