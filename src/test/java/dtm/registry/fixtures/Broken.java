package dtm.registry.fixtures;

public class Broken {
    public Broken(){
        throw new IllegalStateException("boom");
    }
}
