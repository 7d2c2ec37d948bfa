package dev.subfetch.install;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared state of the two dependency stages. Each stage has an {@code installing} flag and a
 * one-shot result cell: the installer thread writes the cell once and the caller takes it once,
 * which clears it.
 */
public class DependencyState {
	private final Map<Stage, AtomicBoolean> available = new EnumMap<>(Stage.class);
	private final Map<Stage, AtomicBoolean> installing = new EnumMap<>(Stage.class);
	private final Map<Stage, AtomicReference<InstallResult>> results = new EnumMap<>(Stage.class);

	public DependencyState() {
		for (Stage stage : Stage.values()) {
			available.put(stage, new AtomicBoolean(false));
			installing.put(stage, new AtomicBoolean(false));
			results.put(stage, new AtomicReference<>());
		}
	}

	public boolean isAvailable(Stage stage) {
		return available.get(stage).get();
	}

	/** @return the previous availability */
	boolean setAvailable(Stage stage, boolean value) {
		return available.get(stage).getAndSet(value);
	}

	public boolean isInstalling(Stage stage) {
		return installing.get(stage).get();
	}

	/** @return true if this call claimed the installing flag */
	boolean beginInstall(Stage stage) {
		return installing.get(stage).compareAndSet(false, true);
	}

	void endInstall(Stage stage) {
		installing.get(stage).set(false);
	}

	/**
	 * Write the result of an installer run.
	 *
	 * @return false if an earlier result has not been taken yet, in which case this one is dropped
	 */
	boolean offerResult(InstallResult result) {
		return results.get(result.stage()).compareAndSet(null, result);
	}

	/** Take and clear the pending result of a stage */
	Optional<InstallResult> takeResult(Stage stage) {
		return Optional.ofNullable(results.get(stage).getAndSet(null));
	}

	public DependencyStatus status() {
		return new DependencyStatus(isAvailable(Stage.PACKAGE_MANAGER), isAvailable(Stage.FETCH_TOOL));
	}
}
