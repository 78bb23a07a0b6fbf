package works.splice;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import works.splice.mapping.SourceMap;

import static java.util.Objects.requireNonNull;

public record SourceAndMap(String text, @Nullable SourceMap sourceMap) {
	public SourceAndMap {
		requireNonNull(text);
	}

	public Optional<SourceMap> map() {
		return Optional.ofNullable(sourceMap);
	}
}
