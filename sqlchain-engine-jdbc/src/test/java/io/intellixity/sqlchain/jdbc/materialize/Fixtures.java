package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.ChangeTracking;
import io.intellixity.sqlchain.annotation.Column;
import io.intellixity.sqlchain.annotation.Decompose;

import java.math.BigDecimal;
import java.util.Objects;

final class Fixtures {
  private Fixtures() {}

  public enum Status { ACTIVE, SUSPENDED }

  public static class Customer {
    private int id;
    private String name;
    private Integer score;
    private Status status;
    private BigDecimal credit;

    public int getId() { return id; }
    public void setId(int id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Integer getScore() { return score; }
    public void setScore(Integer score) { this.score = score; }
    public Status getStatus() { return status; }
    public void setStatus(Status status) { this.status = status; }
    @Column("CreditLimit")
    public BigDecimal getCredit() { return credit; }
    public void setCredit(BigDecimal credit) { this.credit = credit; }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Customer c)) return false;
      return id == c.id && Objects.equals(name, c.name) && Objects.equals(score, c.score)
          && status == c.status && Objects.equals(credit, c.credit);
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, name, score, status, credit);
    }
  }

  public static class Address {
    private String city;
    private String zip;
    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }
    @Column("PostalCode")
    public String getZip() { return zip; }
    public void setZip(String zip) { this.zip = zip; }
  }

  public static class Employee {
    private long id;
    @Decompose("Home")
    private Address home;
    public long getId() { return id; }
    public void setId(long id) { this.id = id; }
    public Address getHome() { return home; }
    public void setHome(Address home) { this.home = home; }
  }

  public record Point(int x, int y) {}

  public static class Person {
    private final String name;
    private final int age;

    public Person(String name, int age) {
      this.name = name;
      this.age = age;
    }

    public String getName() { return name; }
    public int getAge() { return age; }
  }

  public static class Tracked implements ChangeTracking {
    private String name;
    private boolean changed;

    public String getName() { return name; }
    public void setName(String name) {
      this.name = name;
      this.changed = true;
    }

    @Override public boolean isChanged() { return changed; }
    @Override public void acceptChanges() { changed = false; }
  }

  public static class NoDefault {
    private String name;
    public NoDefault(String name) { this.name = name; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
  }
}
