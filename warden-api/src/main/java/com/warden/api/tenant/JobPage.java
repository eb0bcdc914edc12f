package com.warden.api.tenant;

import com.warden.api.dispatch.JobView;

import java.util.List;

public record JobPage(List<JobView> jobs, Pagination pagination) {

  public record Pagination(int page, int perPage, long total, long pages) {}
}
