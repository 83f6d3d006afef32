package com.example.dashboard.util;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Test builder for Person rows.
 */
public class PersonTestBuilder {

    private Long id = 1L;
    private String name = "Alice";
    private Integer age = 30;
    private LocalDate joined = LocalDate.of(2024, 1, 15);
    private String city = "London";
    private String country = "UK";
    private boolean withoutAddress = false;

    public static PersonTestBuilder aPerson() {
        return new PersonTestBuilder();
    }

    public static Person aPerson(long id, String name, Integer age) {
        return aPerson().withId(id).withName(name).withAge(age).build();
    }

    /**
     * People with ids {@code 1..count}, named {@code Person 1}, {@code Person 2}... and aged {@code 20 + id}.
     */
    public static List<Person> people(int count) {
        List<Person> people = new ArrayList<>(count);
        for (long id = 1; id <= count; id++) {
            people.add(aPerson(id, "Person " + id, (int) (20 + id)));
        }
        return people;
    }

    public PersonTestBuilder withId(Long id) {
        this.id = id;
        return this;
    }

    public PersonTestBuilder withName(String name) {
        this.name = name;
        return this;
    }

    public PersonTestBuilder withAge(Integer age) {
        this.age = age;
        return this;
    }

    public PersonTestBuilder withJoined(LocalDate joined) {
        this.joined = joined;
        return this;
    }

    public PersonTestBuilder withCity(String city) {
        this.city = city;
        return this;
    }

    public PersonTestBuilder withCountry(String country) {
        this.country = country;
        return this;
    }

    public PersonTestBuilder withoutAddress() {
        this.withoutAddress = true;
        return this;
    }

    public Person build() {
        return new Person(id, name, age, joined, withoutAddress ? null : new Person.Address(city, country));
    }
}
