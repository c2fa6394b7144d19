package com.tracedemo;

import software.amazon.awscdk.CfnOutput;
import software.amazon.awscdk.Duration;
import software.amazon.awscdk.RemovalPolicy;
import software.amazon.awscdk.Stack;
import software.amazon.awscdk.StackProps;
import software.amazon.awscdk.Tags;
import software.amazon.awscdk.services.iam.Effect;
import software.amazon.awscdk.services.iam.ManagedPolicy;
import software.amazon.awscdk.services.iam.PolicyDocument;
import software.amazon.awscdk.services.iam.PolicyStatement;
import software.amazon.awscdk.services.iam.Role;
import software.amazon.awscdk.services.iam.ServicePrincipal;
import software.amazon.awscdk.services.lambda.Code;
import software.amazon.awscdk.services.lambda.Function;
import software.amazon.awscdk.services.lambda.ILayerVersion;
import software.amazon.awscdk.services.lambda.LayerVersion;
import software.amazon.awscdk.services.lambda.Runtime;
import software.amazon.awscdk.services.lambda.Tracing;
import software.amazon.awscdk.services.logs.CfnLogGroup;
import software.amazon.awscdk.services.ssm.StringParameter;
import software.constructs.Construct;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CDK Stack that deploys the traced demo function together with its execution role, its log group
 * and the Parameter Store copies of its settings.
 * <p>
 * The function creates its tables and buckets on demand, so the role is granted on every replica
 * name ({@code <base>}, {@code <base>-2}, ...) rather than on resources defined here.
 */
public class TracedDemoStack extends Stack {

    static final String HANDLER = "awsTraceDemo.Handler";

    private final Configuration conf;

    public TracedDemoStack(final Construct parent, final String id, final StackProps props, final Configuration conf) {
        super(parent, id, props);
        this.conf = conf;

        //https://docs.aws.amazon.com/cdk/api/v2/java/software/amazon/awscdk/services/logs/CfnLogGroup.html
        //Log group under the name Lambda writes to, so the retention applies from the first invocation
        CfnLogGroup logGroup = CfnLogGroup.Builder.create(this, "FunctionLogGroup")
                .logGroupName("/aws/lambda/" + conf.getFunctionName())
                .retentionInDays(conf.getLogRetentionDays())
                .build();
        logGroup.applyRemovalPolicy(RemovalPolicy.DESTROY);

        Role role = Role.Builder.create(this, "FunctionRole")
                .roleName(conf.getFunctionName() + "-" + conf.getEnvironment() + "-role")
                .assumedBy(new ServicePrincipal("lambda.amazonaws.com"))
                .managedPolicies(List.of(
                        ManagedPolicy.fromAwsManagedPolicyName("service-role/AWSLambdaBasicExecutionRole"),
                        functionPolicy()))
                .build();

        createSSMParameters();

        //https://docs.aws.amazon.com/cdk/api/v2/java/software/amazon/awscdk/services/lambda/Function.html
        Function function = Function.Builder.create(this, "TracedDemoFunction")
                .functionName(conf.getFunctionName())
                .runtime(Runtime.JAVA_17)
                .handler(HANDLER)
                .code(Code.fromAsset(conf.getFunctionJarPath()))
                .memorySize(conf.getFunctionMemoryMb())
                .timeout(Duration.seconds(conf.getFunctionTimeoutSeconds()))
                .role(role)
                .tracing(Tracing.ACTIVE)
                .environment(conf.getFunctionEnvironment())
                .layers(layers())
                .build();
        function.getNode().addDependency(logGroup);

        CfnOutput.Builder.create(this, "FunctionArn").value(function.getFunctionArn()).build();

        Tags.of(this).add("Team", conf.getTeamTag());
        Tags.of(this).add("Environment", conf.getEnvironment());
    }

    private List<ILayerVersion> layers() {
        List<ILayerVersion> layers = new ArrayList<>();
        int index = 0;
        for (String arn : conf.getFunctionLayerArns()) {
            layers.add(LayerVersion.fromLayerVersionArn(this, "Layer" + index++, arn));
        }
        return layers;
    }

    private ManagedPolicy functionPolicy() {
        //https://docs.aws.amazon.com/cdk/api/v2/java/software/amazon/awscdk/services/iam/PolicyStatement.html
        PolicyStatement dynamoDB = PolicyStatement.Builder.create()
                .sid("DynamoDB")
                .effect(Effect.ALLOW)
                .actions(List.of("dynamodb:CreateTable",
                        "dynamodb:DescribeTable",
                        "dynamodb:DeleteTable",
                        "dynamodb:PutItem",
                        "dynamodb:GetItem",
                        "dynamodb:UpdateItem",
                        "dynamodb:DeleteItem"))
                .resources(conf.getTableArns())
                .build();

        PolicyStatement s3 = PolicyStatement.Builder.create()
                .sid("S3")
                .effect(Effect.ALLOW)
                .actions(List.of("s3:CreateBucket",
                        "s3:ListBucket",
                        "s3:PutObject",
                        "s3:GetObject",
                        "s3:DeleteObject"))
                .resources(conf.getBucketArns())
                .build();

        PolicyStatement secrets = PolicyStatement.Builder.create()
                .sid("SecretsManager")
                .effect(Effect.ALLOW)
                .actions(List.of("secretsmanager:GetSecretValue"))
                .resources(List.of("arn:aws:secretsmanager:" + conf.getCustomerRegion() + ":" + conf.getCustomerAccountId()
                        + ":secret:" + conf.getRdsSecretName() + "-*"))
                .build();

        PolicyStatement ssm = PolicyStatement.Builder.create()
                .sid("ParameterStore")
                .effect(Effect.ALLOW)
                .actions(List.of("ssm:GetParameter",
                        "ssm:GetParameters",
                        "ssm:GetParametersByPath"))
                .resources(List.of("arn:aws:ssm:" + conf.getCustomerRegion() + ":" + conf.getCustomerAccountId()
                        + ":parameter" + conf.getParameterPrefix() + "/*"))
                .build();

        PolicyDocument document = PolicyDocument.Builder.create()
                .statements(List.of(dynamoDB, s3, secrets, ssm))
                .build();

        //https://docs.aws.amazon.com/cdk/api/v2/java/software/amazon/awscdk/services/iam/ManagedPolicy.html
        return ManagedPolicy.Builder.create(this, "FunctionPolicy")
                .managedPolicyName(conf.getFunctionName() + "-" + conf.getEnvironment() + "-resources")
                .description("Resources the traced demo function creates and works with")
                .document(document)
                .build();
    }

    private void createSSMParameters() {
        //https://docs.aws.amazon.com/cdk/api/v2/java/software/amazon/awscdk/services/ssm/StringParameter.html
        //Parameter names mirror the environment variable names, the function looks them up as <prefix>/<NAME>
        for (Map.Entry<String, String> setting : conf.getFunctionEnvironment().entrySet()) {
            if ("PARAMETER_PREFIX".equals(setting.getKey()) || setting.getKey().startsWith("OTEL_"))
                continue;
            StringParameter.Builder.create(this, "Param" + setting.getKey())
                    .parameterName(conf.getParameterPrefix() + "/" + setting.getKey())
                    .stringValue(setting.getValue())
                    .build();
        }
    }
}
