package de.bsommerfeld.tassist.training;

public record Client(String name) {
}
