package com.linked.auth;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.ToString;
import lombok.Value;

@Value
public class Credentials {

    String username;

    @ToString.Exclude
    String password;

    @JsonCreator
    public Credentials(@JsonProperty("username") String username,
                       @JsonProperty("password") String password) {
        this.username = username;
        this.password = password;
    }
}
