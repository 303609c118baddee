package com.gdin.inspection.graphalgo.algorithm;

import java.util.Collection;

public class AlgorithmNotFoundException extends RuntimeException {

    public AlgorithmNotFoundException(String name, Collection<String> available) {
        super("Algorithm " + name + " not found. Available: " + available);
    }
}
