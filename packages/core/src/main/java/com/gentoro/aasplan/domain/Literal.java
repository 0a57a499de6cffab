package com.gentoro.aasplan.domain;

import java.util.Objects;

/** Atom with a polarity; {@code positive == false} means the atom must be (or becomes) false. */
public record Literal(Atom atom, boolean positive) {
  public Literal {
    Objects.requireNonNull(atom, "atom");
  }
}
