package com.agora.engine;

import com.agora.model.Persona;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class PersonaCatalog {

    private final List<Persona> personas;

    public PersonaCatalog(List<Persona> personas) {
        if (personas == null || personas.size() < 2) {
            throw new IllegalArgumentException("At least two personas are required");
        }
        this.personas = List.copyOf(personas);
    }

    public List<Persona> all() {
        return personas;
    }

    /**
     * Two distinct personas, uniformly chosen.
     */
    public List<Persona> pickPair(Random random) {
        List<Persona> candidates = new ArrayList<>(personas);
        Persona first = candidates.remove(random.nextInt(candidates.size()));
        Persona second = candidates.remove(random.nextInt(candidates.size()));
        return List.of(first, second);
    }
}
