package awsTraceDemo;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * GET one of the API's posts, picked round robin.
 */
public class ApiWorkflow implements CategoryWorkflow {

    static final int ENDPOINT_COUNT = 3;

    @Override
    public String category() {
        return InvocationEvent.API_OPERATIONS;
    }

    @Override
    public String resultKey() {
        return "api_data";
    }

    @Override
    public String errorType() {
        return "API_OPERATION_FAILED";
    }

    @Override
    public Map<String, Object> run(InvocationContext ctx) {
        String baseUrl = ctx.getConf().getApiBaseUrl();
        List<String> endpoints = new ArrayList<>();
        for (int i = 1; i <= ENDPOINT_COUNT; i++) {
            endpoints.add(baseUrl + "/" + i);
        }
        String endpoint = ResourceSelector.select(endpoints, ctx.getClock()).getSelected();
        ctx.getTrace().addExecutionTag("api_url", endpoint);

        ApiDal dal = new ApiDal(ctx.getClients().getHttpClient(), endpoint, ctx.getExecutor(), ctx.getLog());
        Map<String, Object> result = dal.fetchData();

        ctx.getTrace().addExecutionTag("api_call_status", "success");
        ctx.getTrace().addExecutionTag("post_id", String.valueOf(result.get("post_id")));
        return result;
    }
}
