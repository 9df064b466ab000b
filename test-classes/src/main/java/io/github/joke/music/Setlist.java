package io.github.joke.music;

import io.github.joke.wireform.Expect;
import io.github.joke.wireform.ProtoConvert;
import io.github.joke.wireform.ProtoField;
import java.util.List;
import lombok.Value;

@Value
@ProtoConvert
public class Setlist {
    String venue;

    /** A setlist without songs is rejected. */
    @ProtoField(expect = Expect.ERROR)
    List<String> songs;
}
