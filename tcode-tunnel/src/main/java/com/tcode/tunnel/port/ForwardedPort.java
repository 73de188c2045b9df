package com.tcode.tunnel.port;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Wire shape of a forwarded port sent to the browser.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ForwardedPort {

    private int portNumber;
    private String protocol;
    private List<String> urls = new ArrayList<>();

    @JsonProperty("isUserPort")
    private boolean userPort;
}
