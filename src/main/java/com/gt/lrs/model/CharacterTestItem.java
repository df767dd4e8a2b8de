package com.gt.lrs.model;

// One question of a character test. The concrete shape depends on the skill being tested.
public interface CharacterTestItem {

    int id();

    String correctChar();
}
