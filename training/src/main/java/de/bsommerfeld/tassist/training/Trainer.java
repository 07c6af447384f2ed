package de.bsommerfeld.tassist.training;

/** A trainer and the company details printed on their paperwork. */
public record Trainer(String name, String companyName, String address, String email, String phone) {
}
