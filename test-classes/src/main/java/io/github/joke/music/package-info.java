// Fixture types; nullness is expressed through Optional rather than annotations.
@NullUnmarked
package io.github.joke.music;

import org.jspecify.annotations.NullUnmarked;
