package de.bsommerfeld.tassist.training;

/** An entry of the exercise library. */
public record Exercise(String name) {
}
