package dtm.registry.fixtures.codecs;

import dtm.registry.annotations.Inject;
import dtm.registry.annotations.Plugin;
import dtm.registry.fixtures.Logger;
import lombok.Getter;

@Getter
@Plugin(key = "gzip")
public class GzipCodec extends AbstractCodec {
    @Inject
    private Logger logger;

    @Override
    public String name() {
        return "gzip";
    }
}
