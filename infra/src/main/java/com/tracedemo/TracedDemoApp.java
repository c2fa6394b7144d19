package com.tracedemo;

import software.amazon.awscdk.App;
import software.amazon.awscdk.Environment;
import software.amazon.awscdk.StackProps;

import java.io.IOException;

/**
 An application class that synthesizes the traced demo stack for the environment given in the cdk
 context, e.g. {@code cdk synth -c environment=dev}.
 * */

public final class TracedDemoApp {
    public static void main(final String[] args) throws IOException {
        App app = new App();

        Object environment = app.getNode().tryGetContext("environment");
        //By default, the stack is synthesized for "dev"
        Configuration conf = new Configuration(environment != null ? environment.toString() : "dev");

        Environment env = Environment.builder()
                .account(conf.getCustomerAccountId())
                .region(conf.getCustomerRegion())
                .build();

        new TracedDemoStack(app, conf.getFunctionName() + "-" + conf.getEnvironment(),
                StackProps.builder().env(env).build(), conf);

        app.synth();
    }
}
